package com.edareport.analyzer.dto.profile;

/** Dispatch key decided once per column and threaded through profiling, rendering and assembly. */
public enum ColumnClass {
  NUMERIC,
  CATEGORICAL,
  UNSUPPORTED
}
