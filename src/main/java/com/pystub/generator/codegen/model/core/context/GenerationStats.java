package com.pystub.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import com.pystub.generator.codegen.schedule.ScheduleReport;

import lombok.Getter;

/**
 * Counters of a generation run, accumulated per package.
 */
@Getter
public class GenerationStats {
    private int packagesGenerated;
    private int classesGenerated;
    private int filesWritten;
    private final List<String> placeholderClasses = new ArrayList<>();
    private final List<String> failedClasses = new ArrayList<>();
    private final List<String> fallbackClasses = new ArrayList<>();

    public void addPackage(String packageName, ScheduleReport report) {
        packagesGenerated++;
        classesGenerated += report.getEmitted().size();
        report.getPlaceholders().forEach(name -> placeholderClasses.add(packageName + "." + name));
        report.getFailed().forEach(name -> failedClasses.add(packageName + "." + name));
        report.getEmittedByFallback().forEach(name -> fallbackClasses.add(packageName + "." + name));
    }

    public void addFileWritten() {
        filesWritten++;
    }
}
