package cfd.analyzer.sootupview;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import sootup.core.inputlocation.AnalysisInputLocation;
import sootup.java.bytecode.frontend.inputlocation.JavaClassPathAnalysisInputLocation;
import sootup.java.bytecode.frontend.inputlocation.JrtFileSystemAnalysisInputLocation;
import sootup.java.core.views.JavaView;

public interface ViewFactory {
  JavaView create(List<AnalysisInputLocation> locations);

  /** View over class directories / jars, plus the running JDK's modules when {@code useJrt}. */
  default JavaView forClasspath(List<Path> entries, boolean useJrt) {
    List<AnalysisInputLocation> locs = new ArrayList<>();
    for (Path entry : entries) {
      locs.add(new JavaClassPathAnalysisInputLocation(entry.toString()));
    }
    if (useJrt) locs.add(new JrtFileSystemAnalysisInputLocation());
    return create(locs);
  }
}
