package org.smtbridge.core;

/**
 * 160 位账户地址。无参数，全局单例。
 */
public final class AddressType extends Type {

    public static final AddressType INSTANCE = new AddressType();

    private AddressType() {
    }

    @Override
    public Category getCategory() {
        return Category.ADDRESS;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AddressType;
    }

    @Override
    public int hashCode() {
        return Category.ADDRESS.hashCode();
    }

    @Override
    public String toString() {
        return "address";
    }
}
