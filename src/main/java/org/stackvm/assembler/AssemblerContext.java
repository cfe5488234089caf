package org.stackvm.assembler;

import org.stackvm.runtime.VmLimits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The state shared by both assembler passes: the label table, the address counter and
 * the limits to assemble against. One context is created per assembly and discarded
 * afterwards.
 */
public class AssemblerContext {

    private final String programName;
    private final VmLimits limits;
    private final Map<String, Integer> labels = new LinkedHashMap<>();
    private int address;

    /**
     * @param programName The name used in error messages.
     * @param limits      The code capacity and label limit to enforce.
     */
    public AssemblerContext(String programName, VmLimits limits) {
        this.programName = programName;
        this.limits = limits;
    }

    public String getProgramName() {
        return programName;
    }

    public VmLimits getLimits() {
        return limits;
    }

    /**
     * @return The address the next instruction is placed at.
     */
    public int getAddress() {
        return address;
    }

    /**
     * Advances the address counter by the size of an instruction.
     * @param bytes The instruction size.
     */
    public void advance(int bytes) {
        address += bytes;
    }

    /**
     * Resets the address counter for the next pass. Labels are kept.
     */
    public void resetAddress() {
        address = 0;
    }

    public boolean hasLabel(String name) {
        return labels.containsKey(name);
    }

    /**
     * Records a label at the current address. The caller checks for duplicates and the label limit.
     * @param name The label name.
     */
    public void defineLabel(String name) {
        labels.put(name, address);
    }

    public int labelCount() {
        return labels.size();
    }

    public Optional<Integer> resolve(String name) {
        return Optional.ofNullable(labels.get(name));
    }

    /**
     * @return The label table in definition order.
     */
    public Map<String, Integer> getLabels() {
        return Collections.unmodifiableMap(labels);
    }
}
