package com.modgud.guard.registry;

import com.modgud.guard.common.CommonGuards;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 具名 guard 工厂注册表。
 * <p>
 * 未指定命名空间（null）的注册进入全局表；命名空间在首次注册时创建，
 * 最后一个条目被注销时移除。所有操作由同一把锁保护。
 */
public class GuardRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, GuardFactory> globals = new LinkedHashMap<>();
    private final Map<String, Map<String, GuardFactory>> namespaces = new LinkedHashMap<>();

    /**
     * 创建预先注册了 {@link CommonGuards} 的注册表，位于 {@value CommonGuards#NAMESPACE} 命名空间。
     */
    public static GuardRegistry withCommonGuards() {
        GuardRegistry registry = new GuardRegistry();
        CommonGuards.registerAll(registry);
        return registry;
    }

    public void register(String name, GuardFactory factory) {
        register(name, factory, null);
    }

    /**
     * @throws IllegalArgumentException 同一命名空间中已有同名 guard
     */
    public void register(String name, GuardFactory factory, String namespace) {
        if (name == null || factory == null) {
            throw new IllegalArgumentException("Guard name and factory must not be null");
        }
        lock.lock();
        try {
            if (namespace == null) {
                if (globals.containsKey(name)) {
                    throw new IllegalArgumentException(
                            "Guard '" + name + "' is already registered in global namespace");
                }
                globals.put(name, factory);
            } else {
                Map<String, GuardFactory> table = namespaces.computeIfAbsent(namespace, k -> new LinkedHashMap<>());
                if (table.containsKey(name)) {
                    throw new IllegalArgumentException(
                            "Guard '" + name + "' is already registered in namespace '" + namespace + "'");
                }
                table.put(name, factory);
            }
        } finally {
            lock.unlock();
        }
    }

    public GuardFactory get(String name) {
        return get(name, null);
    }

    /** 未注册时返回 null */
    public GuardFactory get(String name, String namespace) {
        lock.lock();
        try {
            if (namespace == null) {
                return globals.get(name);
            }
            Map<String, GuardFactory> table = namespaces.get(namespace);
            return table != null ? table.get(name) : null;
        } finally {
            lock.unlock();
        }
    }

    public boolean has(String name) {
        return get(name, null) != null;
    }

    public boolean has(String name, String namespace) {
        return get(name, namespace) != null;
    }

    public List<String> list() {
        return list(null);
    }

    /** 按注册顺序列出名称，命名空间不存在时返回空列表 */
    public List<String> list(String namespace) {
        lock.lock();
        try {
            if (namespace == null) {
                return new ArrayList<>(globals.keySet());
            }
            Map<String, GuardFactory> table = namespaces.get(namespace);
            return table != null ? new ArrayList<>(table.keySet()) : Collections.<String>emptyList();
        } finally {
            lock.unlock();
        }
    }

    public List<String> listNamespaces() {
        lock.lock();
        try {
            return new ArrayList<>(namespaces.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean unregister(String name) {
        return unregister(name, null);
    }

    /**
     * @return 是否确实移除了条目
     */
    public boolean unregister(String name, String namespace) {
        lock.lock();
        try {
            if (namespace == null) {
                return globals.remove(name) != null;
            }
            Map<String, GuardFactory> table = namespaces.get(namespace);
            if (table == null || table.remove(name) == null) {
                return false;
            }
            if (table.isEmpty()) {
                namespaces.remove(namespace);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
