package com.modgud.guard.common;

import com.modgud.guard.Guard;
import com.modgud.guard.GuardResult;
import com.modgud.guard.registry.GuardRegistry;

import java.lang.reflect.Array;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 常用 guard。
 * <p>
 * 参数按 {@link com.modgud.guard.CallArguments#extract} 的规则提取：
 * 先按名称查关键字参数，再按位置查位置参数。
 */
public final class CommonGuards {

    public static final String NAMESPACE = "common";

    private static final String DEFAULT_PARAM = "parameter";
    private static final Pattern URL_SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]*:");

    private CommonGuards() {
    }

    /**
     * 把全部常用 guard 注册到 {@value #NAMESPACE} 命名空间。
     * 工厂参数与对应方法的参数顺序一致，省略的参数取默认值。
     */
    public static void registerAll(GuardRegistry registry) {
        registry.register("notEmpty", p -> notEmpty(
                param(p, 0, DEFAULT_PARAM), CommonGuards.<Integer>param(p, 1, null)), NAMESPACE);
        registry.register("notNull", p -> notNull(
                param(p, 0, DEFAULT_PARAM), param(p, 1, 0)), NAMESPACE);
        registry.register("positive", p -> positive(
                param(p, 0, DEFAULT_PARAM), param(p, 1, 0)), NAMESPACE);
        registry.register("inRange", p -> inRange(
                CommonGuards.<Number>param(p, 0, null), CommonGuards.<Number>param(p, 1, null),
                param(p, 2, DEFAULT_PARAM), param(p, 3, 0)), NAMESPACE);
        registry.register("typeCheck", p -> typeCheck(
                CommonGuards.<Class<?>>param(p, 0, null), param(p, 1, DEFAULT_PARAM), param(p, 2, 0)), NAMESPACE);
        registry.register("matchesPattern", p -> matchesPattern(
                CommonGuards.<String>param(p, 0, null), param(p, 1, DEFAULT_PARAM), param(p, 2, 0)), NAMESPACE);
        registry.register("validFilePath", p -> validFilePath(
                param(p, 0, "path"), param(p, 1, 0),
                param(p, 2, true), param(p, 3, false), param(p, 4, false)), NAMESPACE);
        registry.register("validUrl", p -> validUrl(
                param(p, 0, "url"), param(p, 1, 0), param(p, 2, true)), NAMESPACE);
        registry.register("validEnum", p -> validEnum(
                CommonGuards.<Class<? extends Enum<?>>>param(p, 0, null),
                param(p, 1, DEFAULT_PARAM), param(p, 2, 0)), NAMESPACE);
    }

    @SuppressWarnings("unchecked")
    private static <T> T param(Object[] params, int index, T defaultValue) {
        if (params == null || index >= params.length || params[index] == null) {
            return defaultValue;
        }
        return (T) params[index];
    }

    // ==================== 空值 ====================

    public static Guard notEmpty(String paramName) {
        return notEmpty(paramName, null);
    }

    /**
     * 字符串、集合、Map、数组长度为 0 时失败；其他值按真值判断（null、false、0 为空）。
     * 参数缺失视为空字符串。
     */
    public static Guard notEmpty(String paramName, Integer position) {
        return args -> GuardResult.check(
                !isEmptyValue(args.extract(paramName, position, "")),
                paramName + " cannot be empty");
    }

    private static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        if (value instanceof Boolean) {
            return !(Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0;
        }
        return false;
    }

    public static Guard notNull(String paramName) {
        return notNull(paramName, 0);
    }

    public static Guard notNull(String paramName, int position) {
        return args -> GuardResult.check(args.extract(paramName, position, null) != null,
                paramName + " cannot be null");
    }

    // ==================== 数值 ====================

    public static Guard positive(String paramName) {
        return positive(paramName, 0);
    }

    /** 非数值或缺失都视为失败 */
    public static Guard positive(String paramName, int position) {
        return args -> {
            Object value = args.extract(paramName, position, 0);
            return GuardResult.check(value instanceof Number && ((Number) value).doubleValue() > 0,
                    paramName + " must be positive");
        };
    }

    public static Guard inRange(Number min, Number max, String paramName) {
        return inRange(min, max, paramName, 0);
    }

    /**
     * 闭区间 [min, max]
     */
    public static Guard inRange(Number min, Number max, String paramName, int position) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("inRange requires both bounds");
        }
        String message = paramName + " must be between " + min + " and " + max;
        return args -> {
            Object value = args.extract(paramName, position, null);
            if (!(value instanceof Number)) {
                return GuardResult.fail(message);
            }
            double v = ((Number) value).doubleValue();
            return GuardResult.check(min.doubleValue() <= v && v <= max.doubleValue(), message);
        };
    }

    // ==================== 类型与格式 ====================

    public static Guard typeCheck(Class<?> expectedType, String paramName) {
        return typeCheck(expectedType, paramName, 0);
    }

    public static Guard typeCheck(Class<?> expectedType, String paramName, int position) {
        if (expectedType == null) {
            throw new IllegalArgumentException("typeCheck requires an expected type");
        }
        return args -> GuardResult.check(expectedType.isInstance(args.extract(paramName, position, null)),
                paramName + " must be of type " + expectedType.getSimpleName());
    }

    public static Guard matchesPattern(String regex, String paramName) {
        return matchesPattern(regex, paramName, 0);
    }

    /**
     * 值转为字符串后从开头匹配，不要求匹配到末尾。
     */
    public static Guard matchesPattern(String regex, String paramName, int position) {
        if (regex == null) {
            throw new IllegalArgumentException("matchesPattern requires a pattern");
        }
        Pattern pattern = Pattern.compile(regex);
        return args -> {
            String value = String.valueOf(args.extract(paramName, position, ""));
            return GuardResult.check(pattern.matcher(value).lookingAt(),
                    paramName + " must match pattern " + regex);
        };
    }

    // ==================== 文件与 URL ====================

    public static Guard validFilePath(String paramName) {
        return validFilePath(paramName, 0, true, false, false);
    }

    public static Guard validFilePath(String paramName, int position,
                                      boolean mustExist, boolean mustBeFile, boolean mustBeDir) {
        return args -> {
            Object value = args.extract(paramName, position, null);
            if (value == null) {
                return GuardResult.fail(paramName + " is required");
            }
            Path path;
            try {
                path = value instanceof Path ? (Path) value : Paths.get(String.valueOf(value));
            } catch (InvalidPathException e) {
                return GuardResult.fail(paramName + " is not a valid path: " + value);
            }
            if (mustExist && !Files.exists(path)) {
                return GuardResult.fail(paramName + " does not exist: " + value);
            }
            if (mustBeFile && !Files.isRegularFile(path)) {
                return GuardResult.fail(paramName + " must be a file: " + value);
            }
            if (mustBeDir && !Files.isDirectory(path)) {
                return GuardResult.fail(paramName + " must be a directory: " + value);
            }
            return GuardResult.pass();
        };
    }

    public static Guard validUrl(String paramName) {
        return validUrl(paramName, 0, true);
    }

    public static Guard validUrl(String paramName, int position, boolean requireScheme) {
        return args -> {
            Object value = args.extract(paramName, position, null);
            if (value == null) {
                return GuardResult.fail(paramName + " is required");
            }
            String text = String.valueOf(value);
            Matcher scheme = URL_SCHEME.matcher(text);
            if (requireScheme && !scheme.lookingAt()) {
                return GuardResult.fail(paramName + " must include a scheme (http/https): " + value);
            }
            return GuardResult.check(isWellFormedUrl(text), paramName + " is not a valid URL: " + value);
        };
    }

    private static boolean isWellFormedUrl(String text) {
        if (text.isEmpty()) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(text);
        } catch (URISyntaxException e) {
            return false;
        }
        if (uri.isOpaque()) {
            return true;
        }
        boolean hasAuthority = uri.getRawAuthority() != null && !uri.getRawAuthority().isEmpty();
        boolean hasPath = uri.getRawPath() != null && !uri.getRawPath().isEmpty();
        return hasAuthority || hasPath;
    }

    // ==================== 枚举 ====================

    public static Guard validEnum(Class<? extends Enum<?>> enumType, String paramName) {
        return validEnum(enumType, paramName, 0);
    }

    /**
     * 接受枚举实例或常量名字符串
     */
    public static Guard validEnum(Class<? extends Enum<?>> enumType, String paramName, int position) {
        if (enumType == null) {
            throw new IllegalArgumentException("validEnum requires an enum type");
        }
        Enum<?>[] constants = enumType.getEnumConstants();
        String[] names = new String[constants.length];
        for (int i = 0; i < constants.length; i++) {
            names[i] = constants[i].name();
        }
        return args -> {
            Object value = args.extract(paramName, position, null);
            if (value == null) {
                return GuardResult.fail(paramName + " is required");
            }
            if (enumType.isInstance(value)) {
                return GuardResult.pass();
            }
            if (value instanceof String) {
                return GuardResult.check(Arrays.asList(names).contains(value),
                        paramName + " must be one of " + Arrays.toString(names) + ": got " + value);
            }
            return GuardResult.fail(paramName + " must be a valid " + enumType.getSimpleName() + " value");
        };
    }
}
