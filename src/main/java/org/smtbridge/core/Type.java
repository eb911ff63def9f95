package org.smtbridge.core;

/**
 * 类型检查器产出的宿主类型。
 * 所有子类都是不可变的值对象，可在多次调用之间自由共享。
 */
public abstract class Type {

    /**
     * @return 此类型的类别标签。
     */
    public abstract Category getCategory();

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
