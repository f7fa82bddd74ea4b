package org.cognita.document;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of built-in action kinds. Any other action key in a document is an
 * {@link #EXTENSION} action and is dispatched by name through the handler registry.
 */
public enum ActionKind {
    SET("set"),
    LOCAL("local"),
    GLOBAL("global"),
    CLEAR("clear"),
    INCREMENT("increment"),
    DECREMENT("decrement"),
    LOG("log"),
    COND("cond"),
    REPEAT("repeat"),
    FOR_EACH("for_each"),
    GOTO("goto"),
    CALL("call"),
    RETURN("return"),
    CONTINUATION_POINT("continuation_point"),
    EMIT("emit"),
    SET_FEELING("set_feeling"),
    SET_GOAL("set_goal"),
    REMEMBER("remember"),
    TRIGGER_GOAP_REPLAN("trigger_goap_replan"),
    SELF_TERMINATE("self_terminate"),
    WAIT("wait"),
    WAIT_FOR("wait_for"),
    SYNC("sync"),
    EXTENSION(null);

    private static final Map<String, ActionKind> BY_KEY = new HashMap<>();

    static {
        for (ActionKind kind : values()) {
            if (kind.key != null) {
                BY_KEY.put(kind.key, kind);
            }
        }
    }

    private final String key;

    ActionKind(String key) {
        this.key = key;
    }

    /**
     * @return The document key of this kind, or null for {@link #EXTENSION}.
     */
    public String key() {
        return key;
    }

    /**
     * Maps a document action key to its kind.
     * @param key The action key.
     * @return The built-in kind, or {@link #EXTENSION}.
     */
    public static ActionKind fromKey(String key) {
        return BY_KEY.getOrDefault(key.toLowerCase(Locale.ROOT), EXTENSION);
    }

    /**
     * @return true for kinds that nest action blocks.
     */
    public boolean hasBody() {
        return this == COND || this == REPEAT || this == FOR_EACH;
    }
}
