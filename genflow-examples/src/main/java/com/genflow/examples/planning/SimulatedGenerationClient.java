package com.genflow.examples.planning;

import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for a text-generation backend.
 * 
 * Recognizes the prompts of the quality module (scoring, review, fix) and answers
 * them with well-formed replies. Every other prompt gets a markdown document.
 * Failures are scripted per prompt fragment so demos can show retries and resume.
 */
public class SimulatedGenerationClient implements GenerationClient {
    
    private static final Logger log = LoggerFactory.getLogger(SimulatedGenerationClient.class);
    
    /** Marks content that went through a fix pass. */
    public static final String REVISION_MARKER = "Revision notes:";
    
    private static final Pattern STEP_LINE = Pattern.compile("^Step: (.+)$", Pattern.MULTILINE);
    private static final Pattern IDEA_LINE = Pattern.compile("^Project idea: (.+)$", Pattern.MULTILINE);
    private static final Pattern FIX_CONTENT = Pattern.compile("Current content:\\R(.*?)\\R\\R---\\R", Pattern.DOTALL);
    
    private final List<ScriptedFailure> failures = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    
    private static final class ScriptedFailure {
        private final String fragment;
        private final GenerationException error;
        private int remaining;
        
        ScriptedFailure(String fragment, int remaining, GenerationException error) {
            this.fragment = fragment;
            this.remaining = remaining;
            this.error = error;
        }
        
        /** Consumes one use; returns true once the failure is used up. */
        boolean consume() {
            return remaining != Integer.MAX_VALUE && --remaining <= 0;
        }
    }
    
    /**
     * Fail the next call, whatever its prompt.
     */
    public SimulatedGenerationClient failNext(GenerationException error) {
        return failTimes("", 1, error);
    }
    
    /**
     * Fail the next {@code times} calls whose prompt contains {@code fragment}.
     */
    public synchronized SimulatedGenerationClient failTimes(String fragment, int times, GenerationException error) {
        failures.add(new ScriptedFailure(fragment, times, error));
        return this;
    }
    
    /**
     * Fail every document prompt for the step with this display name.
     */
    public SimulatedGenerationClient failStep(String displayName, GenerationException error) {
        return failTimes("Step: " + displayName + "\n", Integer.MAX_VALUE, error);
    }
    
    public synchronized void clearFailures() {
        failures.clear();
    }
    
    public int getCallCount() {
        return calls.get();
    }
    
    @Override
    public String generate(String prompt, GenerationOptions options) throws GenerationException {
        calls.incrementAndGet();
        throwScriptedFailure(prompt);
        
        if (prompt.contains("Issues to fix:")) {
            return fixReply(prompt);
        }
        if (prompt.contains("\"findings\"")) {
            return reviewReply(prompt);
        }
        if (prompt.contains("\"overall\"")) {
            return scoreReply(prompt);
        }
        return documentReply(prompt);
    }
    
    private synchronized void throwScriptedFailure(String prompt) throws GenerationException {
        Iterator<ScriptedFailure> it = failures.iterator();
        while (it.hasNext()) {
            ScriptedFailure failure = it.next();
            if (prompt.contains(failure.fragment)) {
                if (failure.consume()) {
                    it.remove();
                }
                log.info("  [simulated] failing call {}: {}", calls.get(), failure.error.getMessage());
                throw failure.error;
            }
        }
    }
    
    private String documentReply(String prompt) {
        String step = firstGroup(STEP_LINE, prompt, "Document");
        String idea = firstGroup(IDEA_LINE, prompt, "an unnamed product");
        return "# " + step + "\n\n"
            + "## Context\n" + idea + "\n\n"
            + "## Content\n"
            + "- Primary users and their main job to be done\n"
            + "- Key decisions for the " + step.toLowerCase(Locale.ROOT) + " phase\n"
            + "- Open risks carried into the next step\n";
    }
    
    private String scoreReply(String prompt) {
        if (prompt.contains(REVISION_MARKER)) {
            return "{\"overall\": 86, \"grade\": \"B\", \"categories\": ["
                + "{\"name\": \"Completeness\", \"score\": 18, \"maxScore\": 20, \"issues\": [], \"suggestions\": []}"
                + "], \"summary\": \"Solid after revision\"}";
        }
        return "Here is my evaluation:\n"
            + "{\"overall\": 58, \"grade\": \"F\", \"categories\": ["
            + "{\"name\": \"Measurability\", \"score\": 8, \"maxScore\": 20, "
            + "\"issues\": [\"Goals have no success metrics\"], \"suggestions\": [\"Add target numbers\"]},"
            + "{\"name\": \"Completeness\", \"score\": 12, \"maxScore\": 20, "
            + "\"issues\": [\"Edge cases are not covered\"], \"suggestions\": []}"
            + "], \"summary\": \"Too vague to build from\"}";
    }
    
    private String reviewReply(String prompt) {
        if (prompt.contains(REVISION_MARKER)) {
            return "{\"findings\": [{\"severity\": \"minor\", \"category\": \"Style\", "
                + "\"finding\": \"Headings are inconsistent\", \"impact\": \"Readability\", "
                + "\"recommendation\": \"Use sentence case\"}]}";
        }
        return "{\"findings\": ["
            + "{\"severity\": \"critical\", \"category\": \"Security\", \"finding\": \"No authentication between services\", "
            + "\"impact\": \"Any caller can read user data\", \"recommendation\": \"Require mutual TLS\"},"
            + "{\"severity\": \"major\", \"category\": \"Scalability\", \"finding\": \"Single database instance\", "
            + "\"impact\": \"Outage on failure\", \"recommendation\": \"Add a replica\"}"
            + "]}";
    }
    
    private String fixReply(String prompt) {
        Matcher matcher = FIX_CONTENT.matcher(prompt);
        String content = matcher.find() ? matcher.group(1) : "";
        return "## IMPROVED CONTENT\n"
            + content + "\n\n"
            + REVISION_MARKER + " measurable goals and edge cases added.\n\n"
            + "## CHANGES\n"
            + "- Added success metrics\n"
            + "- Covered edge cases\n";
    }
    
    private static String firstGroup(Pattern pattern, String text, String fallback) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : fallback;
    }
}
