package com.modgud.guard.registry;

import com.modgud.guard.Guard;

/**
 * 按参数构造 guard 的工厂
 */
@FunctionalInterface
public interface GuardFactory {

    Guard create(Object... params);
}
