package com.earnix.ccf.table;

import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The values of one column: N optional values of the column's declared type. Presence is decided by the null mask
 * only, so an empty string is a present value.
 */
public abstract class ColumnValues
{
	private final ColumnDescriptor descriptor;
	private final boolean[] nulls;

	protected ColumnValues(ColumnDescriptor descriptor, DataType expectedType, boolean[] nulls)
	{
		this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
		if (descriptor.getType() != expectedType)
			throw new IllegalArgumentException(
					"Column " + descriptor.getName() + " is declared " + descriptor.getType() + " but holds "
							+ expectedType + " values");
		this.nulls = nulls;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	public String getName()
	{
		return descriptor.getName();
	}

	public int getNumRows()
	{
		return nulls.length;
	}

	public boolean isNull(int row)
	{
		return nulls[row];
	}

	/**
	 * @param row the row index
	 * @return the boxed value of the row, or null if the row is NULL
	 */
	public abstract Object getValue(int row);

	/**
	 * @return copy of the null mask, true for NULL rows
	 */
	public boolean[] getNullMask()
	{
		return nulls.clone();
	}

	/**
	 * @return all rows as boxed values, nulls included
	 */
	public List<Object> toList()
	{
		List<Object> ret = new ArrayList<>(getNumRows());
		for (int i = 0; i < getNumRows(); i++)
		{
			ret.add(getValue(i));
		}
		return ret;
	}

	protected boolean[] nulls()
	{
		return nulls;
	}

	@Override
	public String toString()
	{
		return descriptor + "=" + toList();
	}
}
