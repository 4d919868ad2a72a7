package com.earnix.ccf.table;

import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

public class IntColumnValues extends ColumnValues
{
	private final int[] values;

	/**
	 * @param descriptor the INT32 column
	 * @param values     the row values. Slots of NULL rows are ignored.
	 * @param nulls      the null mask, same length as values
	 */
	public IntColumnValues(ColumnDescriptor descriptor, int[] values, boolean[] nulls)
	{
		super(descriptor, DataType.INT32, nulls.clone());
		if (values.length != nulls.length)
			throw new IllegalArgumentException("values and null mask lengths differ");
		this.values = values.clone();
		for (int i = 0; i < nulls.length; i++)
		{
			if (nulls[i])
				this.values[i] = 0;
		}
	}

	public IntColumnValues(ColumnDescriptor descriptor, int[] values)
	{
		this(descriptor, values, new boolean[values.length]);
	}

	public static IntColumnValues of(String name, Integer... values)
	{
		int[] ints = new int[values.length];
		boolean[] nulls = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
		{
			nulls[i] = values[i] == null;
			ints[i] = nulls[i] ? 0 : values[i];
		}
		return new IntColumnValues(new ColumnDescriptor(name, DataType.INT32), ints, nulls);
	}

	public int getInteger(int row)
	{
		if (isNull(row))
			throw new IllegalStateException("Row " + row + " of " + getName() + " is null");
		return values[row];
	}

	@Override
	public Integer getValue(int row)
	{
		return isNull(row) ? null : values[row];
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		IntColumnValues that = (IntColumnValues) o;
		return new EqualsBuilder().append(getDescriptor(), that.getDescriptor()).append(nulls(), that.nulls())
				.append(values, that.values).isEquals();
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder().append(getDescriptor()).append(nulls()).append(values).toHashCode();
	}
}
