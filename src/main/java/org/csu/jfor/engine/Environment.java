package org.csu.jfor.engine;

import org.csu.jfor.common.exception.NameException;
import org.csu.jfor.common.model.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 唯一的全局变量表。没有嵌套作用域，循环变量也只是普通的条目，循环结束后仍然可见。
 */
public class Environment {
    private final Map<String, Value> variables = new HashMap<>();

    public Value get(String name) {
        Value value = variables.get(name);
        if (value == null) {
            throw new NameException(name);
        }
        return value;
    }

    public void set(String name, Value value) {
        variables.put(name, Objects.requireNonNull(value, "value"));
    }

    public boolean isDefined(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    /**
     * @return 当前所有绑定的只读副本
     */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(variables));
    }
}
