package com.pystub.generator.codegen.model.output;

import java.util.List;

import com.pystub.generator.codegen.schedule.ScheduleReport;

import lombok.NonNull;
import lombok.Value;

/**
 * Files generated for one package, with what happened to its classes.
 */
@Value
public class PackageStub {

    @NonNull
    String packageName;

    @NonNull
    List<GeneratedFile> files;

    @NonNull
    ScheduleReport report;
}
