package com.earnix.ccf.writer.columnblock;

import com.earnix.ccf.block.ColumnBlock;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.table.ColumnValues;

import java.util.Iterator;
import java.util.PrimitiveIterator;

/**
 * An interface to encode CCF column blocks. Iterators may be of any length; the file writer checks the row count.
 */
public interface ColumnBlockWriter
{
	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, int[] vals);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, Integer[] vals);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, PrimitiveIterator.OfInt iterator);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, NullableIterators.NullableIntegerIterator iterator);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, double[] vals);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, Double[] vals);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, PrimitiveIterator.OfDouble iterator);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, NullableIterators.NullableDoubleIterator iterator);

	ColumnBlock writeColumn(ColumnDescriptor columnDescriptor, String[] vals);

	ColumnBlock writeStringColumn(ColumnDescriptor columnDescriptor, Iterator<String> vals);

	ColumnBlock writeStringColumn(ColumnDescriptor columnDescriptor,
			NullableIterators.NullableObjectIterator<String> iterator);

	ColumnBlock writeColumn(ColumnValues values);
}
