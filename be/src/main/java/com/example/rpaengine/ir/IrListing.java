package com.example.rpaengine.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable disassembly of a program, one line per instruction, with scenario headers and
 * try-range annotations.
 */
public final class IrListing {

    private IrListing() {
    }

    public static List<String> render(IrProgram program, CallTable callTable, List<TryRange> tryRanges) {
        List<String> lines = new ArrayList<>();
        for (int address = 0; address < program.size(); address++) {
            for (CallTable.Entry entry : callTable.entries()) {
                if (entry.entryAddress() == address) {
                    lines.add("; scenario " + entry.scenarioId() + " (" + entry.name() + ") params=" + entry.parameters().size());
                }
            }
            StringBuilder line = new StringBuilder(String.format("%04d  %s", address, program.get(address).describe()));
            for (TryRange range : tryRanges) {
                if (range.start() == address) {
                    line.append("    ; try [").append(range.start()).append(", ").append(range.end())
                            .append(") catch -> ").append(range.catchTarget());
                }
            }
            lines.add(line.toString());
        }
        return lines;
    }
}
