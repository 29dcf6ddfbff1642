package cfd.analyzer.io;

import cfd.analyzer.model.DistanceRecord;

public interface OutputSink extends AutoCloseable {
  void write(DistanceRecord rec) throws Exception;

  @Override
  default void close() throws Exception {}
}
