package com.grabber.core.retry;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects access-block and authentication conditions from backend error text by
 * substring signatures. The signature lists come from configuration and are heuristic.
 */
public class FailureClassifier {

    private static final Pattern ANSI = Pattern.compile("\\u001B\\[[0-9;?]*[ -/]*[@-~]");

    private final List<String> blockSignatures;
    private final List<String> authSignatures;

    public FailureClassifier(List<String> blockSignatures, List<String> authSignatures) {
        this.blockSignatures = normalize(blockSignatures);
        this.authSignatures = normalize(authSignatures);
    }

    public FailureClassification classify(String errorText) {
        if (errorText == null || errorText.isEmpty()) return FailureClassification.NONE;
        String text = stripAnsi(errorText).toLowerCase(Locale.ROOT);
        return new FailureClassification(matchesAny(text, blockSignatures), matchesAny(text, authSignatures));
    }

    public boolean isIpBlocked(String errorText) {
        return classify(errorText).ipBlocked();
    }

    public static String stripAnsi(String text) {
        return ANSI.matcher(text).replaceAll("");
    }

    private static boolean matchesAny(String text, List<String> signatures) {
        for (String s : signatures) {
            if (text.contains(s)) return true;
        }
        return false;
    }

    private static List<String> normalize(List<String> signatures) {
        if (signatures == null) return List.of();
        return signatures.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }
}
