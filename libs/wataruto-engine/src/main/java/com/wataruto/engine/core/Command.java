package com.wataruto.engine.core;

/**
 * 玩家或 AI 的一次输入（如“从 (3,4) 到 (3,6) 放一条长条”）。
 * 传输层只负责序列化，不关心其内容。
 */
public interface Command {

    /** 创建时的毫秒时间戳，只用于历史排序，规则不读它 */
    long timestamp();
}
