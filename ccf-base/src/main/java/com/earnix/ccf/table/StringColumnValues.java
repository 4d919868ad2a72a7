package com.earnix.ccf.table;

import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

public class StringColumnValues extends ColumnValues
{
	private final String[] values;

	/**
	 * @param descriptor the UTF8_STRING column
	 * @param values     the row values, null entries are NULL rows
	 */
	public StringColumnValues(ColumnDescriptor descriptor, String[] values)
	{
		super(descriptor, DataType.UTF8_STRING, nullMaskOf(values));
		this.values = values.clone();
	}

	public static StringColumnValues of(String name, String... values)
	{
		return new StringColumnValues(new ColumnDescriptor(name, DataType.UTF8_STRING), values);
	}

	private static boolean[] nullMaskOf(String[] values)
	{
		boolean[] nulls = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
		{
			nulls[i] = values[i] == null;
		}
		return nulls;
	}

	public String getString(int row)
	{
		if (isNull(row))
			throw new IllegalStateException("Row " + row + " of " + getName() + " is null");
		return values[row];
	}

	@Override
	public String getValue(int row)
	{
		return values[row];
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		StringColumnValues that = (StringColumnValues) o;
		return new EqualsBuilder().append(getDescriptor(), that.getDescriptor()).append(values, that.values)
				.isEquals();
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder().append(getDescriptor()).append(values).toHashCode();
	}
}
