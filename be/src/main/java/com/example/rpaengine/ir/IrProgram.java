package com.example.rpaengine.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Append-only instruction sequence shared by all scenarios of a project; the address of an
 * instruction is its index.
 * <p>
 * Targets unknown at emission time are filled in with {@link #patch}. Once {@link #seal()} has
 * verified every target the program is immutable.
 * </p>
 */
public final class IrProgram {

    private final List<Instruction> instructions = new ArrayList<>();
    private boolean sealed;

    /**
     * Appends an instruction and returns its address.
     */
    public int emit(Instruction instruction) {
        checkMutable();
        instructions.add(Objects.requireNonNull(instruction, "instruction"));
        return instructions.size() - 1;
    }

    /**
     * Address the next emitted instruction will get.
     */
    public int nextAddress() {
        return instructions.size();
    }

    public void patch(int address, UnaryOperator<Instruction> patcher) {
        checkMutable();
        Instruction current = get(address);
        Instruction patched = Objects.requireNonNull(patcher.apply(current), "patched instruction");
        if (patched.getClass() != current.getClass()) {
            throw new IllegalStateException("patch at " + address + " changed " + current.getClass().getSimpleName()
                    + " into " + patched.getClass().getSimpleName());
        }
        instructions.set(address, patched);
    }

    public Instruction get(int address) {
        if (address < 0 || address >= instructions.size()) {
            throw new IllegalArgumentException("address out of range: " + address);
        }
        return instructions.get(address);
    }

    public int size() {
        return instructions.size();
    }

    public List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    /**
     * Checks that no placeholder is left and every target is inside the program, then freezes it.
     *
     * @throws IllegalStateException naming the first offending address
     */
    public void seal() {
        for (int address = 0; address < instructions.size(); address++) {
            for (int target : instructions.get(address).targets()) {
                if (target == Instruction.PLACEHOLDER) {
                    throw new IllegalStateException("unpatched target at address " + address + ": "
                            + instructions.get(address).describe());
                }
                if (target < 0 || target >= instructions.size()) {
                    throw new IllegalStateException("target " + target + " out of range at address " + address);
                }
            }
        }
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("program is sealed");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IrProgram other && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }
}
