package com.vcc.router.service.firewall;

import com.vcc.router.model.DetectorSpec;
import com.vcc.router.model.Policy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Builds the ordered detector chain of a policy version. Only the newest version seen for each app
 * is cached; policy versions never change once published.
 */
@Component
public class DetectorFactory {

    private static final Map<String, Supplier<Detector>> BUILTINS = Map.of(
            CreditCardDetector.NAME, CreditCardDetector::new,
            "email", () -> new PatternDetector("email",
                    Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}")),
            "us_ssn", () -> new PatternDetector("us_ssn",
                    Pattern.compile("\\b(?!000|666|9\\d\\d)\\d{3}-(?!00)\\d{2}-(?!0000)\\d{4}\\b")),
            // Live and test secret keys in the sk_live_/pk_test_ style, plus sk- prefixed keys
            "api_key", () -> new PatternDetector("api_key",
                    Pattern.compile("\\b(?:sk|pk|rk)_(?:live|test)_[A-Za-z0-9]{8,}\\b|\\bsk-[A-Za-z0-9]{16,}\\b"))
    );

    public static final Set<String> BUILTIN_NAMES = BUILTINS.keySet();

    private final Map<String, CachedChain> cache = new ConcurrentHashMap<>();

    public List<Detector> detectorsFor(Policy policy) {
        CachedChain cached = cache.compute(policy.appId(), (appId, current) -> {
            if (current != null && current.version() >= policy.version()) {
                return current;
            }
            return new CachedChain(policy.version(), build(policy.firewall().detectors()));
        });
        if (cached.version() == policy.version()) {
            return cached.detectors();
        }
        // In-flight request still holding a superseded version
        return build(policy.firewall().detectors());
    }

    int cachedApps() {
        return cache.size();
    }

    static List<Detector> build(List<DetectorSpec> specs) {
        List<Detector> detectors = new ArrayList<>(specs.size());
        for (DetectorSpec spec : specs) {
            if (spec.effectiveType() == DetectorSpec.Type.PATTERN) {
                detectors.add(new PatternDetector(spec.name(), spec.pattern()));
            } else {
                Supplier<Detector> builtin = BUILTINS.get(spec.name());
                if (builtin == null) {
                    throw new IllegalArgumentException("unknown builtin detector '" + spec.name() + "'");
                }
                detectors.add(builtin.get());
            }
        }
        return List.copyOf(detectors);
    }

    private record CachedChain(long version, List<Detector> detectors) {
    }
}
