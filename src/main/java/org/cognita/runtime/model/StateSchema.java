package org.cognita.runtime.model;

import java.util.List;

/**
 * The numeric state vector layout of a behavior model: named input slots with default
 * values and named output slots.
 *
 * @param inputs  The input slots in index order.
 * @param outputs The output slot names in index order.
 */
public record StateSchema(List<InputSlot> inputs, List<String> outputs) {

    /**
     * A named input slot.
     * @param name The slot name.
     * @param defaultValue The value used when the caller's input vector does not cover the slot.
     */
    public record InputSlot(String name, double defaultValue) {}

    public StateSchema {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * @return An empty schema.
     */
    public static StateSchema empty() {
        return new StateSchema(List.of(), List.of());
    }

    public int inputCount() {
        return inputs.size();
    }

    public int outputCount() {
        return outputs.size();
    }

    /**
     * Looks up an input slot by name.
     * @param name The slot name.
     * @return The slot index, or -1 if not declared.
     */
    public int inputIndexOf(String name) {
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Looks up an output slot by name.
     * @param name The slot name.
     * @return The slot index, or -1 if not declared.
     */
    public int outputIndexOf(String name) {
        return outputs.indexOf(name);
    }

    /**
     * Builds an input vector filled with the declared defaults.
     * @return A new array of length {@link #inputCount()}.
     */
    public double[] defaultInputs() {
        double[] values = new double[inputs.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = inputs.get(i).defaultValue();
        }
        return values;
    }
}
