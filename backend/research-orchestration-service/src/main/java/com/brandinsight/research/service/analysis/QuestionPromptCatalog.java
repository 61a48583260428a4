package com.brandinsight.research.service.analysis;

import com.brandinsight.research.entity.AiQuestionType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Question text and system prompt per analysis dimension.
 * Every system prompt starts with the shared evidence rules.
 */
final class QuestionPromptCatalog {

    record QuestionPrompt(String question, String systemPrompt) {
    }

    static final String EVIDENCE_RULES = """
            You are a senior brand strategist writing for a client who will act on your analysis.
            Rules:
            - Ground every claim in the supplied context. When the context does not support a claim, say so.
            - Lead with critique: name what is weak, generic or unproven before proposing anything.
            - Prefer specific, testable recommendations over general advice.
            - Never invent metrics, customers or competitors that are not in the context.
            """;

    private static final Map<AiQuestionType, QuestionPrompt> PROMPTS = new EnumMap<>(AiQuestionType.class);

    static {
        put(AiQuestionType.VALUE_PROPOSITION,
                "What is this brand's real value proposition, broken down into gains it creates and pains it removes?",
                """
                Frame the answer with the Value Proposition Canvas.
                1. Gain creators: concrete positive outcomes the brand delivers.
                2. Pain relievers: frustrations it removes for the customer.
                3. Core offer: the products or services behind both.
                4. Hard-to-copy edge: the one thing a rival would struggle to replicate.
                Close with a verdict on whether the current positioning is generic and how to sharpen it.""");

        put(AiQuestionType.TARGET_AUDIENCE,
                "Who is the ideal customer, described by the job they hire this brand to do?",
                """
                Use Jobs To Be Done rather than demographics.
                1. Core job statement: when [situation], I want to [motivation], so I can [outcome].
                2. Push: what drives them away from their current solution.
                3. Pull: what attracts them to this brand.
                4. Friction: the anxiety or habit that stops them switching.
                5. The most devoted customer this brand could win, described as one person.""");

        put(AiQuestionType.CONTENT_PILLARS,
                "Which five content pillars should anchor this brand's publishing, mapped to the funnel?",
                """
                Design five pillars covering reach, authority, community, conversion and behind-the-scenes.
                For each pillar give its purpose and three concrete headline ideas.""");

        put(AiQuestionType.BRAND_VOICE,
                "How should this brand sound, and where does it sit on the main tone dimensions?",
                """
                1. Place the voice on funny/serious, formal/casual, respectful/irreverent and enthusiastic/matter-of-fact.
                2. Three adjectives that define the voice.
                3. Example phrases to use and phrases to avoid.
                4. A character comparison that captures the voice.
                5. Formatting rules for emoji, casing and slang.""");

        put(AiQuestionType.BRAND_PERSONALITY,
                "Which brand archetypes best describe this brand's personality?",
                """
                1. Primary archetype and the evidence for it.
                2. Secondary archetype that adds nuance.
                3. What the brand stands against.
                4. The feeling customers are left with after an interaction.
                5. Visual cues that fit this personality.""");

        put(AiQuestionType.COMPETITOR_ANALYSIS,
                "Where does this brand stand against its competitors, and where is the open market gap?",
                """
                1. The main rivals, using the known competitors in the context where available.
                2. What everyone in the category does that makes them interchangeable.
                3. The unmet need nobody is serving.
                4. Weak spots rivals leave exposed.
                5. How to position rivals as the outdated option.""");

        put(AiQuestionType.NICHE_POSITION,
                "Which narrow category can this brand own outright?",
                """
                Work through a strategy canvas.
                1. The narrow category definition.
                2. Industry habits to eliminate.
                3. What to reduce.
                4. What to raise well above the category norm.
                5. New value nobody in the category offers yet.""");

        put(AiQuestionType.UNIQUE_STRENGTHS,
                "Which of this brand's strengths are valuable, rare and hard to imitate?",
                """
                Assess each strength for value, rarity, imitability and organisational support.
                Identify the defensible moat and one asset the brand is under-using.""");

        put(AiQuestionType.CONTENT_OPPORTUNITIES,
                "Where are the highest-leverage content opportunities for this brand right now?",
                """
                1. The platform where attention is cheapest for this brand.
                2. Formats the brand could own.
                3. Three recurring series concepts.
                4. Timely angles that fit the brand without feeling forced.
                5. How to repurpose what already works.""");

        put(AiQuestionType.GROWTH_STRATEGY,
                "What growth plan fits this brand across acquisition, activation, retention, referral and revenue?",
                """
                Give one concrete experiment per funnel stage.
                Prefer loops where one customer brings the next over one-way funnels.""");

        put(AiQuestionType.PAIN_POINTS,
                "What are the root causes behind this brand's customers' pain points?",
                """
                Repeatedly ask why until the root cause appears.
                1. Surface complaint.
                2. The fear underneath it.
                3. What it says about the customer to themselves.
                4. Who or what they blame.
                5. How the brand addresses the root cause and not only the symptom.""");

        put(AiQuestionType.KEY_DIFFERENTIATORS,
                "What makes this brand the only choice for its customer, and how should that be stated?",
                """
                1. An only-statement: the only [category] that [benefit] for [customer] in [context].
                2. Why customers should choose it even when rivals are cheaper or bigger.
                3. What the brand opposes.
                4. Who the brand should deliberately not appeal to.
                5. A one-line hook.""");

        put(AiQuestionType.CUSTOM,
                "",
                "Answer the question thoroughly with evidence from the context.");
    }

    private QuestionPromptCatalog() {
    }

    private static void put(AiQuestionType type, String question, String instructions) {
        PROMPTS.put(type, new QuestionPrompt(question, EVIDENCE_RULES + "\n" + instructions));
    }

    static QuestionPrompt promptFor(AiQuestionType type) {
        return PROMPTS.get(type);
    }
}
