package com.mk.fx.qa.lode.cli;

/** How the final report is printed to stdout. */
public enum OutputFormat {
  TEXT,
  JSON
}
