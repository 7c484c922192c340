package com.forex.optimizer.configuration;

/**
 * 参数取值：引用一个特征（构建时解析为列位置）或一个数值常量
 */
public sealed interface OptionValue permits OptionValue.Reference, OptionValue.Literal {

    static OptionValue reference(String featureName) {
        return new Reference(featureName);
    }

    static OptionValue literal(double value) {
        return new Literal(value);
    }

    record Reference(String featureName) implements OptionValue {
        public Reference {
            if (featureName == null || featureName.isBlank()) {
                throw new IllegalArgumentException("特征名不能为空");
            }
        }
    }

    record Literal(double value) implements OptionValue {
    }
}
