package com.earnix.ccf.writer.columnblock;

import com.earnix.ccf.block.ColumnBlock;

import java.io.IOException;

@FunctionalInterface
public interface ColumnValuesWritingFunction
{
	ColumnBlock apply(ColumnBlockWriter columnBlockWriter) throws IOException;
}
