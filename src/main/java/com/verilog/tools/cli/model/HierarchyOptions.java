package com.verilog.tools.cli.model;

import lombok.Builder;
import lombok.Value;

/**
 * Which views the hierarchy printer produces.
 */
@Value
@Builder
public class HierarchyOptions {
	boolean cells;
	boolean forest;
	boolean modules;
	boolean moduleFiles;
	boolean includes;
	boolean inputFiles;
	boolean missing;
	boolean instance;
	boolean xml;
	boolean skeleton;
	boolean dump;
}
