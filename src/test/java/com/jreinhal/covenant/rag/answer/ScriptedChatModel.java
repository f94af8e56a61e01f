package com.jreinhal.covenant.rag.answer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Chat model whose replies come from a function of the prompt. Records every prompt it sees.
 */
class ScriptedChatModel implements ChatModel {
    private final Function<Prompt, String> script;
    private final List<Prompt> prompts = Collections.synchronizedList(new ArrayList<>());

    ScriptedChatModel(Function<Prompt, String> script) {
        this.script = script;
    }

    static ScriptedChatModel replying(String reply) {
        return new ScriptedChatModel(prompt -> reply);
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        prompts.add(prompt);
        return new ChatResponse(List.of(new Generation(new AssistantMessage(script.apply(prompt)))));
    }

    int calls() {
        return prompts.size();
    }

    Prompt lastPrompt() {
        return prompts.get(prompts.size() - 1);
    }
}
