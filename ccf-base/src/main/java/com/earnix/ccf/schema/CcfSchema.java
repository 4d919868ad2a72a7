package com.earnix.ccf.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered columns of a CCF file. The order is the canonical column order and the order of the on-disk metadata
 * and blocks.
 */
public final class CcfSchema
{
	private final List<ColumnDescriptor> columns;
	private final Map<String, Integer> indexByName;

	public CcfSchema(List<ColumnDescriptor> columns)
	{
		this.columns = List.copyOf(columns);
		Map<String, Integer> byName = new HashMap<>();
		for (int i = 0; i < this.columns.size(); i++)
		{
			String name = this.columns.get(i).getName();
			if (byName.put(name, i) != null)
				throw new IllegalArgumentException("Duplicate column name: " + name);
		}
		this.indexByName = Collections.unmodifiableMap(byName);
	}

	public static CcfSchema of(ColumnDescriptor... columns)
	{
		return new CcfSchema(Arrays.asList(columns));
	}

	public List<ColumnDescriptor> getColumns()
	{
		return columns;
	}

	public int getNumColumns()
	{
		return columns.size();
	}

	public ColumnDescriptor getColumn(int index)
	{
		return columns.get(index);
	}

	/**
	 * @param name the column name
	 * @return the position of the column in schema order, if present
	 */
	public Optional<Integer> indexOf(String name)
	{
		return Optional.ofNullable(indexByName.get(name));
	}

	public Optional<ColumnDescriptor> findColumn(String name)
	{
		return indexOf(name).map(columns::get);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof CcfSchema && columns.equals(((CcfSchema) o).columns);
	}

	@Override
	public int hashCode()
	{
		return columns.hashCode();
	}

	@Override
	public String toString()
	{
		return "CcfSchema" + columns;
	}
}
