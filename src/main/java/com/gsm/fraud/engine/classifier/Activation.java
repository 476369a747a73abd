package com.gsm.fraud.engine.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Activation {
    RELU {
        @Override
        public double apply(double x) {
            return x > 0 ? x : 0.0;
        }
    },
    SIGMOID {
        @Override
        public double apply(double x) {
            // Split on sign so exp() never overflows
            if (x >= 0) {
                return 1.0 / (1.0 + Math.exp(-x));
            }
            double e = Math.exp(x);
            return e / (1.0 + e);
        }
    };

    public abstract double apply(double x);

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Activation fromJson(String name) {
        return Activation.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
