package com.modgud.guard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次调用的参数：位置参数加关键字参数。
 */
public final class CallArguments {
    private static final CallArguments EMPTY =
            new CallArguments(Collections.emptyList(), Collections.<String, Object>emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    public CallArguments(List<?> positional, Map<String, ?> keywords) {
        this.positional = positional == null || positional.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<Object>(positional));
        this.keywords = keywords == null || keywords.isEmpty()
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(keywords));
    }

    public static CallArguments of(Object... positional) {
        return positional.length == 0 ? EMPTY
                : new CallArguments(Arrays.asList(positional), null);
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    /** 追加一个关键字参数，返回新实例 */
    public CallArguments withKeyword(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.put(name, value);
        return new CallArguments(positional, copy);
    }

    public List<Object> getPositional() {
        return positional;
    }

    public Map<String, Object> getKeywords() {
        return keywords;
    }

    public int size() {
        return positional.size();
    }

    /** 位置参数，越界时返回 null */
    public Object get(int position) {
        return position >= 0 && position < positional.size() ? positional.get(position) : null;
    }

    public Object get(String name) {
        return keywords.get(name);
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    /**
     * 提取参数值：先按名称查关键字参数，再按位置查位置参数（position 为 null 时取第一个），
     * 都没有时返回 defaultValue。
     */
    public Object extract(String name, Integer position, Object defaultValue) {
        if (name != null && keywords.containsKey(name)) {
            return keywords.get(name);
        }
        int pos = position != null ? position : 0;
        if (pos >= 0 && pos < positional.size()) {
            return positional.get(pos);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "CallArguments" + positional + (keywords.isEmpty() ? "" : keywords.toString());
    }
}
