package com.vcc.router.service.firewall;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fires on every match of a regular expression.
 */
public class PatternDetector implements Detector {

    private final String name;
    private final Pattern pattern;

    public PatternDetector(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    public PatternDetector(String name, String regex) {
        this(name, Pattern.compile(regex));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectionResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return DetectionResult.none(name);
        }
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (!matcher.group().isEmpty()) {
                matches.add(matcher.group());
            }
        }
        return new DetectionResult(name, matches, false);
    }
}
