package com.vcc.router.service.firewall;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card numbers: runs of 13 to 19 digits, optionally separated by spaces or dashes, that pass the
 * Luhn check. Runs failing the check are reported as inconclusive rather than ignored.
 */
public class CreditCardDetector implements Detector {

    public static final String NAME = "credit_card";

    private static final Pattern DIGIT_RUN = Pattern.compile("(?<![\\d-])\\d(?:[ -]?\\d){12,18}(?![\\d-])");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return DetectionResult.none(NAME);
        }
        List<String> matches = new ArrayList<>();
        boolean inconclusive = false;
        Matcher matcher = DIGIT_RUN.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group().replaceAll("[ -]", "");
            if (digits.length() < 13 || digits.length() > 19) {
                continue;
            }
            if (luhnValid(digits)) {
                matches.add(matcher.group());
            } else {
                inconclusive = true;
            }
        }
        return new DetectionResult(NAME, matches, inconclusive && matches.isEmpty());
    }

    static boolean luhnValid(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}
