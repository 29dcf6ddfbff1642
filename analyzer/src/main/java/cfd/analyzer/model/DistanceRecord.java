package cfd.analyzer.model;

import cfd.analyzer.search.SearchResult;

public record DistanceRecord(
  DistanceQuery query,
  SearchResult result,
  long elapsedMs
) {}
