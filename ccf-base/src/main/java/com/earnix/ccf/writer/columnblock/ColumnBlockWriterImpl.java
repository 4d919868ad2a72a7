package com.earnix.ccf.writer.columnblock;

import com.earnix.ccf.block.ColumnBlock;
import com.earnix.ccf.block.ColumnBlockCodec;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import com.earnix.ccf.table.ColumnValues;
import com.earnix.ccf.table.DoubleColumnValues;
import com.earnix.ccf.table.IntColumnValues;
import com.earnix.ccf.table.StringColumnValues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.PrimitiveIterator;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

public class ColumnBlockWriterImpl implements ColumnBlockWriter
{
	private static final int INITIAL_CAPACITY = 16;

	private final ColumnBlockCodec codec;

	/**
	 * @param codec the codec used to serialize and compress each block
	 */
	public ColumnBlockWriterImpl(ColumnBlockCodec codec)
	{
		this.codec = codec;
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, int[] vals)
	{
		return writeColumn(column, IntStream.of(vals).iterator());
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, Integer[] vals)
	{
		return writeColumn(column, NullableIterators.wrapBoxedIntegerIterator(Arrays.asList(vals).iterator()));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, PrimitiveIterator.OfInt iterator)
	{
		return writeColumn(column, NullableIterators.wrapIntegerIterator(iterator));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, NullableIterators.NullableIntegerIterator iterator)
	{
		expectType(column, DataType.INT32);
		int[] values = new int[INITIAL_CAPACITY];
		boolean[] nulls = new boolean[INITIAL_CAPACITY];
		int numRows = 0;
		while (iterator.next())
		{
			if (numRows == values.length)
			{
				values = Arrays.copyOf(values, numRows * 2);
				nulls = Arrays.copyOf(nulls, numRows * 2);
			}
			if (iterator.isNull())
				nulls[numRows] = true;
			else
				values[numRows] = iterator.getValue();
			numRows++;
		}
		return writeColumn(
				new IntColumnValues(column, Arrays.copyOf(values, numRows), Arrays.copyOf(nulls, numRows)));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, double[] vals)
	{
		return writeColumn(column, DoubleStream.of(vals).iterator());
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, Double[] vals)
	{
		return writeColumn(column, NullableIterators.wrapBoxedDoubleIterator(Arrays.asList(vals).iterator()));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, PrimitiveIterator.OfDouble iterator)
	{
		return writeColumn(column, NullableIterators.wrapDoubleIterator(iterator));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, NullableIterators.NullableDoubleIterator iterator)
	{
		expectType(column, DataType.FLOAT64);
		double[] values = new double[INITIAL_CAPACITY];
		boolean[] nulls = new boolean[INITIAL_CAPACITY];
		int numRows = 0;
		while (iterator.next())
		{
			if (numRows == values.length)
			{
				values = Arrays.copyOf(values, numRows * 2);
				nulls = Arrays.copyOf(nulls, numRows * 2);
			}
			if (iterator.isNull())
				nulls[numRows] = true;
			else
				values[numRows] = iterator.getValue();
			numRows++;
		}
		return writeColumn(
				new DoubleColumnValues(column, Arrays.copyOf(values, numRows), Arrays.copyOf(nulls, numRows)));
	}

	@Override
	public ColumnBlock writeColumn(ColumnDescriptor column, String[] vals)
	{
		return writeStringColumn(column, Arrays.asList(vals).iterator());
	}

	@Override
	public ColumnBlock writeStringColumn(ColumnDescriptor column, Iterator<String> vals)
	{
		return writeStringColumn(column, NullableIterators.wrapObjectIterator(vals));
	}

	@Override
	public ColumnBlock writeStringColumn(ColumnDescriptor column,
			NullableIterators.NullableObjectIterator<String> iterator)
	{
		expectType(column, DataType.UTF8_STRING);
		List<String> values = new ArrayList<>();
		while (iterator.next())
		{
			values.add(iterator.isNull() ? null : iterator.getValue());
		}
		return writeColumn(new StringColumnValues(column, values.toArray(new String[0])));
	}

	@Override
	public ColumnBlock writeColumn(ColumnValues values)
	{
		return codec.encode(values);
	}

	private static void expectType(ColumnDescriptor column, DataType type)
	{
		if (column.getType() != type)
			throw new IllegalArgumentException(
					"Column " + column.getName() + " is " + column.getType() + ", cannot write " + type + " values");
	}
}
