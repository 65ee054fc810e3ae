package com.phillippitts.jobverdict.testutil;

import com.phillippitts.jobverdict.exception.TransportException;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LLM client fake that answers calls from a script, in call order.
 *
 * <p>Each script entry is either a response string or a {@link RuntimeException} to throw. Once the
 * script is exhausted the last entry is repeated. Prompts are recorded for verification.
 */
public class ScriptedLlmClient implements LlmEvaluationClient {

    private final List<Object> script;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private volatile boolean pingResult = true;

    private ScriptedLlmClient(List<Object> script) {
        if (script.isEmpty()) {
            throw new IllegalArgumentException("script must not be empty");
        }
        this.script = new ArrayList<>(script);
    }

    public static ScriptedLlmClient responding(Object... script) {
        return new ScriptedLlmClient(List.of(script));
    }

    public static ScriptedLlmClient failing(String message) {
        return responding(new TransportException(message, "scripted"));
    }

    @Override
    public String evaluate(String prompt, Duration timeout) {
        prompts.add(prompt);
        int i = calls.getAndIncrement();
        Object next = script.get(Math.min(i, script.size() - 1));
        if (next instanceof RuntimeException e) {
            throw e;
        }
        return (String) next;
    }

    @Override
    public boolean ping() {
        return pingResult;
    }

    @Override
    public String name() {
        return "scripted";
    }

    public ScriptedLlmClient withPing(boolean result) {
        this.pingResult = result;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public List<String> prompts() {
        return prompts;
    }
}
