package org.csu.jfor.engine.loop;

import org.csu.jfor.engine.Environment;

/**
 * @description: 循环驱动器接口，所有 for 形式共用的状态机
 *
 * Init -> CheckCondition -> (RunBody -> RunStep -> CheckCondition)* -> Exit
 * 由 ExecutionEngine 驱动，驱动器只负责三个可变的环节，循环体的执行不在这里。
 */
public interface LoopDriver {

    /**
     * Init: 在第一次检查条件之前执行一次
     */
    void init(Environment env);

    /**
     * CheckCondition: 返回 true 时执行一次循环体，返回 false 时循环结束
     */
    boolean checkCondition(Environment env);

    /**
     * RunStep: 每次循环体执行完之后调用
     */
    void step(Environment env);

    /**
     * @return 用于诊断信息的循环形式名称
     */
    String describe();
}
