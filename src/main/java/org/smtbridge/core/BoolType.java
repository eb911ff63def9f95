package org.smtbridge.core;

public final class BoolType extends Type {

    public static final BoolType INSTANCE = new BoolType();

    private BoolType() {
    }

    @Override
    public Category getCategory() {
        return Category.BOOL;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BoolType;
    }

    @Override
    public int hashCode() {
        return Category.BOOL.hashCode();
    }

    @Override
    public String toString() {
        return "bool";
    }
}
