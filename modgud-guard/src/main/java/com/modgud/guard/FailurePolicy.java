package com.modgud.guard;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.function.Function;

/**
 * guard 失败后的处理策略。
 * <ul>
 *   <li>RAISE - 用失败消息构造异常并抛出</li>
 *   <li>HANDLE - 调用处理器，返回值作为调用结果</li>
 *   <li>VALUE - 直接返回给定的值</li>
 * </ul>
 */
public abstract class FailurePolicy {

    public enum Kind {
        RAISE, HANDLE, VALUE
    }

    private FailurePolicy() {
    }

    public abstract Kind getKind();

    abstract GuardOutcome apply(String message, CallArguments args);

    /** 默认策略：抛出 {@link GuardClauseException} */
    public static FailurePolicy defaultPolicy() {
        return raise(GuardClauseException.class);
    }

    /**
     * 抛出指定类型的异常，该类型必须有 (String) 构造器。
     */
    public static FailurePolicy raise(Class<? extends RuntimeException> exceptionType) {
        final Constructor<? extends RuntimeException> constructor;
        try {
            constructor = exceptionType.getConstructor(String.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    exceptionType.getName() + " has no public (String) constructor", e);
        }
        return raise(message -> {
            try {
                return constructor.newInstance(message);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Failed to create " + exceptionType.getName(), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to create " + exceptionType.getName(), e);
            }
        });
    }

    public static FailurePolicy raise(Function<String, ? extends RuntimeException> factory) {
        return new FailurePolicy() {
            @Override
            public Kind getKind() {
                return Kind.RAISE;
            }

            @Override
            GuardOutcome apply(String message, CallArguments args) {
                return GuardOutcome.error(factory.apply(message));
            }
        };
    }

    public static FailurePolicy handle(FailureHandler handler) {
        return new FailurePolicy() {
            @Override
            public Kind getKind() {
                return Kind.HANDLE;
            }

            @Override
            GuardOutcome apply(String message, CallArguments args) {
                return GuardOutcome.value(handler.handle(message, args));
            }
        };
    }

    public static FailurePolicy returnValue(Object value) {
        return new FailurePolicy() {
            @Override
            public Kind getKind() {
                return Kind.VALUE;
            }

            @Override
            GuardOutcome apply(String message, CallArguments args) {
                return GuardOutcome.value(value);
            }
        };
    }

    /**
     * 按顺序识别原始策略值：异常类型 → 处理器 → 普通值。
     * <p>
     * 只有 {@link FailureHandler} 会被当作处理器调用；其他函数式对象（如
     * {@link java.util.function.BiFunction}）按普通值原样返回，需要调用时请先适配为
     * FailureHandler 或使用 {@link #handle(FailureHandler)}。
     */
    @SuppressWarnings("unchecked")
    public static FailurePolicy of(Object policy) {
        if (policy instanceof FailurePolicy) {
            return (FailurePolicy) policy;
        }
        if (policy instanceof Class && Throwable.class.isAssignableFrom((Class<?>) policy)) {
            if (!RuntimeException.class.isAssignableFrom((Class<?>) policy)) {
                throw new IllegalArgumentException(
                        "Failure exception type must be unchecked: " + ((Class<?>) policy).getName());
            }
            return raise((Class<? extends RuntimeException>) policy);
        }
        if (policy instanceof FailureHandler) {
            return handle((FailureHandler) policy);
        }
        return returnValue(policy);
    }
}
