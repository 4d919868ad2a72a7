package com.earnix.ccf.table;

import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An in-memory table: a row count shared by every column and one {@link ColumnValues} per schema column, in schema
 * order.
 */
public final class CcfTable
{
	private final CcfSchema schema;
	private final long numRows;
	private final List<ColumnValues> columns;

	public CcfTable(long numRows, List<? extends ColumnValues> columns)
	{
		this.numRows = numRows;
		this.columns = List.copyOf(columns);
		this.schema = new CcfSchema(
				this.columns.stream().map(ColumnValues::getDescriptor).collect(Collectors.toList()));
		for (ColumnValues column : this.columns)
		{
			if (column.getNumRows() != numRows)
				throw new IllegalArgumentException(
						"Column " + column.getName() + " has " + column.getNumRows() + " rows, expected " + numRows);
		}
	}

	/**
	 * Build a table from columns. The row count is taken from the first column; a table without columns has 0 rows.
	 *
	 * @param columns the columns in schema order
	 * @return the table
	 */
	public static CcfTable of(ColumnValues... columns)
	{
		long numRows = columns.length == 0 ? 0 : columns[0].getNumRows();
		return new CcfTable(numRows, Arrays.asList(columns));
	}

	public CcfSchema getSchema()
	{
		return schema;
	}

	public long getNumRows()
	{
		return numRows;
	}

	public List<ColumnValues> getColumns()
	{
		return columns;
	}

	public ColumnValues getColumn(int index)
	{
		return columns.get(index);
	}

	public ColumnValues getColumn(String name)
	{
		return schema.indexOf(name).map(columns::get)
				.orElseThrow(() -> new IllegalArgumentException("No such column: " + name));
	}

	public List<String> getColumnNames()
	{
		return schema.getColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
	}

	/**
	 * @param row the row index
	 * @return the boxed values of the row in column order, NULL values as null
	 */
	public List<Object> getRow(int row)
	{
		Objects.checkIndex(row, Math.toIntExact(numRows));
		List<Object> ret = new ArrayList<>(columns.size());
		for (ColumnValues column : columns)
		{
			ret.add(column.getValue(row));
		}
		return Collections.unmodifiableList(ret);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof CcfTable))
			return false;
		CcfTable that = (CcfTable) o;
		return numRows == that.numRows && columns.equals(that.columns);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(numRows, columns);
	}

	@Override
	public String toString()
	{
		return "CcfTable{numRows=" + numRows + ", columns=" + columns + '}';
	}
}
