package com.vcc.router.service.firewall;

import com.vcc.router.model.InvocationOptions;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.service.invocation.ProviderAdapter;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Asks a judge model whether the text contains sensitive data. The judge answers {@code CLEAN} or
 * {@code SENSITIVE: <span>}; anything else counts as clean.
 */
@Component
public class ModelJudgedDetector implements ContextualDetector {

    static final String JUDGE_INSTRUCTION = "Decide whether the following text discloses personal data, "
            + "payment data or credentials. Answer exactly CLEAN, or SENSITIVE: followed by the offending span.";

    private static final String SENSITIVE = "SENSITIVE";

    private final ProviderAdapter providerAdapter;

    public ModelJudgedDetector(ProviderAdapter providerAdapter) {
        this.providerAdapter = providerAdapter;
    }

    @Override
    public Mono<Judgement> judge(ModelDescriptor judgeModel, String output) {
        return providerAdapter.invoke(judgeModel, output, InvocationOptions.withInstruction(JUDGE_INSTRUCTION))
                .map(response -> new Judgement(parseVerdict(response.text()), response.usage()));
    }

    static DetectionResult parseVerdict(String verdict) {
        if (verdict == null) {
            return DetectionResult.none(NAME);
        }
        String trimmed = verdict.trim();
        if (!trimmed.toUpperCase(Locale.ROOT).startsWith(SENSITIVE)) {
            return DetectionResult.none(NAME);
        }
        String span = trimmed.substring(SENSITIVE.length()).replaceFirst("^\\s*:\\s*", "").trim();
        return new DetectionResult(NAME, List.of(span.isEmpty() ? SENSITIVE.toLowerCase(Locale.ROOT) : span), false);
    }
}
