package cfd.analyzer.sootupview;

import java.util.List;
import sootup.core.inputlocation.AnalysisInputLocation;
import sootup.java.core.views.JavaView;

public final class DefaultViewFactory implements ViewFactory {

  @Override
  public JavaView create(List<AnalysisInputLocation> locs) {
    if (locs.isEmpty()) throw new IllegalArgumentException(
      "at least one input location is required"
    );
    return new JavaView(locs);
  }
}
