package com.pystub.generator.codegen.schedule;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * What happened to the classes of one package, by local name, in emission order.
 */
@Getter
public class ScheduleReport {

    private final List<String> emitted = new ArrayList<>();
    private final List<String> emittedByFallback = new ArrayList<>();
    private final List<String> placeholders = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    public int getClassCount() {
        return emitted.size();
    }
}
