package org.smtbridge.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.utils.Contracts;

import java.util.Objects;

/**
 * 合约类型，仅按名称区分。
 */
@Getter
public final class ContractType extends Type {

    private final String name;

    private ContractType(String name) {
        Contracts.require(StringUtils.isNotBlank(name), "ContractType-构造函数: 合约名不能为空");
        this.name = name;
    }

    public static ContractType of(String name) {
        return new ContractType(name);
    }

    @Override
    public Category getCategory() {
        return Category.CONTRACT;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return name.equals(((ContractType) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.CONTRACT, name);
    }

    @Override
    public String toString() {
        return "contract " + name;
    }
}
