package com.eainde.auditor.generator;

import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.model.ScoreScale;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link OpinionGenerator} backed by a langchain4j {@link ChatModel}. The system message carries
 * the role's lens and the JSON contract, the user message the criterion and the evidence.
 */
public class ChatModelOpinionGenerator implements OpinionGenerator {

    private static final int MAX_CONTENT_PREVIEW = 500;

    private final ChatModel chatModel;
    private final ScoreScale scale;

    public ChatModelOpinionGenerator(ChatModel chatModel, ScoreScale scale) {
        this.chatModel = chatModel;
        this.scale = scale;
    }

    @Override
    public String generate(ReviewerRole role, Criterion criterion, Map<String, List<Evidence>> evidence) {
        ChatResponse response = chatModel.chat(List.of(
                SystemMessage.from(systemPrompt(role)),
                UserMessage.from(criterionPrompt(criterion, evidence))));
        return response.aiMessage().text();
    }

    String systemPrompt(ReviewerRole role) {
        return "You are the " + role.displayName() + " on a code audit bench.\n"
                + role.lens() + "\n\n"
                + "YOUR RESPONSE MUST BE A SINGLE VALID JSON OBJECT with this structure:\n"
                + "{\n"
                + "  \"score\": <int " + scale.min() + "-" + scale.max() + ">,\n"
                + "  \"argument\": \"<argument citing evidence locations>\",\n"
                + "  \"cited_evidence\": [\"<location1>\", \"<location2>\"]\n"
                + "}\n"
                + "Do NOT include any text before or after the JSON.";
    }

    String criterionPrompt(Criterion criterion, Map<String, List<Evidence>> evidence) {
        StringBuilder prompt = new StringBuilder()
                .append("## Criterion: ").append(criterion.name()).append(" (ID: ").append(criterion.id()).append(")\n\n")
                .append("### Target Artifact: ").append(criterion.targetArtifact()).append("\n\n")
                .append("### Forensic Instruction\n").append(criterion.forensicInstruction()).append("\n\n")
                .append("### Collected Evidence\n");
        new TreeMap<>(evidence).forEach((sourceKey, items) -> {
            prompt.append("\n=== Evidence Source: ").append(sourceKey.toUpperCase(Locale.ROOT)).append(" ===\n");
            for (Evidence item : items) {
                prompt.append("[").append(item.found() ? "FOUND" : "NOT FOUND").append("] Goal: ").append(item.goal()).append('\n')
                        .append("  Location: ").append(item.location()).append('\n')
                        .append("  Confidence: ").append(item.confidence()).append('\n')
                        .append("  Rationale: ").append(item.rationale()).append('\n');
                if (item.content() != null && !item.content().isBlank()) {
                    String content = item.content();
                    prompt.append("  Content: ")
                            .append(content.length() > MAX_CONTENT_PREVIEW
                                    ? content.substring(0, MAX_CONTENT_PREVIEW) + "... [truncated]"
                                    : content)
                            .append('\n');
                }
            }
        });
        prompt.append("\nRender your opinion for this criterion. The score must be an integer from ")
                .append(scale.min()).append(" to ").append(scale.max())
                .append(" and cited_evidence must list locations from the evidence above.");
        return prompt.toString();
    }
}
