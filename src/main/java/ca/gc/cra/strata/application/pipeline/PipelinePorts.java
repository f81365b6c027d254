package ca.gc.cra.strata.application.pipeline;

import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.ConfigWriter;
import ca.gc.cra.strata.application.port.ExperimentDirectoryPort;
import ca.gc.cra.strata.application.port.SourceReader;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;

/** Adapters a configuration uses for I/O; shared by a config, its copies and its variations. */
record PipelinePorts(
    SourceReader reader,
    ConfigWriter writer,
    ExperimentDirectoryPort directories,
    ClockPort clock,
    ZoneId zone,
    Path workingDirectory) {

  PipelinePorts {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(writer, "writer");
    Objects.requireNonNull(directories, "directories");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(zone, "zone");
    workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory").toAbsolutePath().normalize();
  }
}
