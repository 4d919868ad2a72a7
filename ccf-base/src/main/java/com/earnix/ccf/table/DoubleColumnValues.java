package com.earnix.ccf.table;

import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Arrays;

public class DoubleColumnValues extends ColumnValues
{
	private final double[] values;

	/**
	 * @param descriptor the FLOAT64 column
	 * @param values     the row values. Slots of NULL rows are ignored.
	 * @param nulls      the null mask, same length as values
	 */
	public DoubleColumnValues(ColumnDescriptor descriptor, double[] values, boolean[] nulls)
	{
		super(descriptor, DataType.FLOAT64, nulls.clone());
		if (values.length != nulls.length)
			throw new IllegalArgumentException("values and null mask lengths differ");
		this.values = values.clone();
		for (int i = 0; i < nulls.length; i++)
		{
			if (nulls[i])
				this.values[i] = 0d;
		}
	}

	public DoubleColumnValues(ColumnDescriptor descriptor, double[] values)
	{
		this(descriptor, values, new boolean[values.length]);
	}

	public static DoubleColumnValues of(String name, Double... values)
	{
		double[] doubles = new double[values.length];
		boolean[] nulls = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
		{
			nulls[i] = values[i] == null;
			doubles[i] = nulls[i] ? 0d : values[i];
		}
		return new DoubleColumnValues(new ColumnDescriptor(name, DataType.FLOAT64), doubles, nulls);
	}

	public double getDouble(int row)
	{
		if (isNull(row))
			throw new IllegalStateException("Row " + row + " of " + getName() + " is null");
		return values[row];
	}

	@Override
	public Double getValue(int row)
	{
		return isNull(row) ? null : values[row];
	}

	// bit-exact comparison: NaN payloads and signed zeros must survive a round trip unchanged
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		DoubleColumnValues that = (DoubleColumnValues) o;
		if (!getDescriptor().equals(that.getDescriptor()) || !Arrays.equals(nulls(), that.nulls()))
			return false;
		for (int i = 0; i < values.length; i++)
		{
			if (Double.doubleToRawLongBits(values[i]) != Double.doubleToRawLongBits(that.values[i]))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder().append(getDescriptor()).append(nulls()).append(values).toHashCode();
	}
}
