package com.hcltech.lineage.graph;

import com.hcltech.lineage.common.random.IRandom;
import com.hcltech.lineage.graph.exceptions.FormatException;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A display name of the form {@code <letters><digits>}, e.g. {@code A0} or {@code bc12}. */
public record NodeName(String prefix, BigInteger suffix) {
    private static final Pattern PATTERN = Pattern.compile("([A-Za-z]+)(\\d+)");
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    public NodeName {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(suffix, "suffix");
        if (prefix.isEmpty() || !prefix.chars().allMatch(c -> (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')))
            throw new FormatException("Name prefix must be one or more ASCII letters but was '" + prefix + "'");
        if (suffix.signum() < 0)
            throw new FormatException("Name suffix must not be negative but was " + suffix);
    }

    public static NodeName parse(String name) {
        if (name == null) throw new FormatException("Name must not be null");
        Matcher m = PATTERN.matcher(name);
        if (!m.matches())
            throw new FormatException("Name '" + name + "' does not match <letters><digits>");
        return new NodeName(m.group(1), new BigInteger(m.group(2)));
    }

    public static boolean isValid(String name) {
        return name != null && PATTERN.matcher(name).matches();
    }

    /** A0, B0 ... Z0, BA0, BB0 ... for i = 0, 1, 2 ...; the letters are i written in base 26. */
    public static String nth(int i) {
        if (i < 0) throw new IllegalArgumentException("index must be >= 0 but was " + i);
        StringBuilder letters = new StringBuilder();
        int n = i;
        while (true) {
            letters.insert(0, ALPHABET.charAt(n % 26));
            n /= 26;
            if (n == 0) break;
        }
        return letters + "0";
    }

    /** The rename bump: the whole prefix in a randomly chosen case, the suffix plus one. */
    public NodeName bump(IRandom random) {
        String newPrefix = random.nextBoolean()
                ? prefix.toUpperCase(Locale.ROOT)
                : prefix.toLowerCase(Locale.ROOT);
        return new NodeName(newPrefix, suffix.add(BigInteger.ONE));
    }

    @Override
    public String toString() {
        return prefix + suffix;
    }
}
