package com.neohoods.bridge.services.matrix;

import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for Matrix user ids, room aliases and the direct-room pair key.
 */
public final class MatrixIds {

    public static final String PAIR_KEY_SEPARATOR = "|";

    private MatrixIds() {
    }

    /**
     * Reduces a user id or alias to its lowercased localpart: {@code "@Alice:srv"} and {@code "#alice:srv"} both give
     * {@code "alice"}.
     */
    public static String normalizeLocalpart(String value) {
        if (value == null) {
            return "";
        }
        String v = value.trim();
        if (v.startsWith("#")) {
            v = v.substring(1);
        }
        if (v.startsWith("@")) {
            v = v.substring(1);
        }
        int colon = v.indexOf(':');
        if (colon >= 0) {
            v = v.substring(0, colon);
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isUserId(String value) {
        return value != null && value.trim().startsWith("@");
    }

    public static boolean isRoomId(String value) {
        return value != null && value.trim().startsWith("!");
    }

    public static boolean sameUser(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return left.trim().equalsIgnoreCase(right.trim());
    }

    /**
     * Order-independent key for the conversation between two users, also used as the room alias localpart.
     */
    public static String pairKey(String userA, String userB) {
        String a = normalizeLocalpart(userA);
        String b = normalizeLocalpart(userB);
        if (a.compareTo(b) > 0) {
            String swap = a;
            a = b;
            b = swap;
        }
        return a + PAIR_KEY_SEPARATOR + b;
    }

    /**
     * Given an alias following the pair-key convention and one side of it, returns the other side's localpart.
     */
    public static Optional<String> otherSideOfPairKey(String alias, String viewer) {
        String normalized = normalizeLocalpart(alias);
        int separator = normalized.indexOf(PAIR_KEY_SEPARATOR);
        if (separator < 0) {
            return Optional.empty();
        }
        String left = normalized.substring(0, separator).trim();
        String right = normalized.substring(separator + 1).trim();
        String me = normalizeLocalpart(viewer);
        if (left.equals(me)) {
            return Optional.of(right);
        }
        if (right.equals(me)) {
            return Optional.of(left);
        }
        return Optional.empty();
    }

    public static String roomAlias(String localpart, String serverName) {
        return "#" + localpart + ":" + serverName;
    }

    public static String serverNameOf(String id) {
        if (id == null) {
            return null;
        }
        int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(colon + 1) : null;
    }
}
