package cfd.analyzer.io;

import cfd.analyzer.model.DistanceQuery;
import cfd.analyzer.program.Program;
import java.util.List;

public record ProgramDocument(Program program, List<DistanceQuery> queries) {}
