package org.smtbridge.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;

/**
 * 定义将排序描述转换为 Z3 Sort 的接口。
 */
public interface ToZ3Sort {

    /**
     * 将此对象转换为 Z3 排序。
     * @param ctx Z3 Context 实例。
     * @return 对应的 Z3 Sort。
     */
    Sort toZ3Sort(Context ctx);
}
