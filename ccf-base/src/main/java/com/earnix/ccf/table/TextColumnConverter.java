package com.earnix.ccf.table;

import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Converts textual cells, as found in delimited text files, to column values and back. An empty cell is NULL.
 */
public class TextColumnConverter
{
	private TextColumnConverter()
	{
	}

	/**
	 * Infer the narrowest type holding every non empty cell: INT32, then FLOAT64, then UTF8_STRING. A column with no
	 * non empty cells is INT32.
	 *
	 * @param cells the textual cells of one column
	 * @return the inferred type
	 */
	public static DataType inferType(List<String> cells)
	{
		boolean isInt = true;
		boolean isDouble = true;
		for (String cell : cells)
		{
			if (isNullCell(cell))
				continue;
			if (isInt && Ints.tryParse(cell) == null)
				isInt = false;
			if (!isInt && Doubles.tryParse(cell) == null)
			{
				isDouble = false;
				break;
			}
		}
		if (isInt)
			return DataType.INT32;
		return isDouble ? DataType.FLOAT64 : DataType.UTF8_STRING;
	}

	/**
	 * Parse a type name: int or int32, float or float64. Any other name is a string type.
	 *
	 * @param typeName the type name
	 * @return the type
	 */
	public static DataType parseTypeName(String typeName)
	{
		switch (typeName.trim().toLowerCase(Locale.ROOT))
		{
		case "int":
		case "int32":
			return DataType.INT32;
		case "float":
		case "float64":
			return DataType.FLOAT64;
		default:
			return DataType.UTF8_STRING;
		}
	}

	/**
	 * Convert the textual cells of one column
	 *
	 * @param descriptor the column
	 * @param cells      the cells, empty or null cells are NULL
	 * @return the column values
	 * @throws IllegalArgumentException if a cell does not parse as the column type
	 */
	public static ColumnValues toColumnValues(ColumnDescriptor descriptor, List<String> cells)
	{
		int numRows = cells.size();
		boolean[] nulls = new boolean[numRows];
		switch (descriptor.getType())
		{
		case INT32:
			int[] ints = new int[numRows];
			for (int i = 0; i < numRows; i++)
			{
				String cell = cells.get(i);
				if (isNullCell(cell))
				{
					nulls[i] = true;
					continue;
				}
				Integer parsed = Ints.tryParse(cell);
				if (parsed == null)
					throw new IllegalArgumentException(
							"Row " + i + " of " + descriptor.getName() + " is not a 32-bit integer: " + cell);
				ints[i] = parsed;
			}
			return new IntColumnValues(descriptor, ints, nulls);
		case FLOAT64:
			double[] doubles = new double[numRows];
			for (int i = 0; i < numRows; i++)
			{
				String cell = cells.get(i);
				if (isNullCell(cell))
				{
					nulls[i] = true;
					continue;
				}
				Double parsed = Doubles.tryParse(cell);
				if (parsed == null)
					throw new IllegalArgumentException(
							"Row " + i + " of " + descriptor.getName() + " is not a number: " + cell);
				doubles[i] = parsed;
			}
			return new DoubleColumnValues(descriptor, doubles, nulls);
		case UTF8_STRING:
			String[] strings = new String[numRows];
			for (int i = 0; i < numRows; i++)
			{
				String cell = cells.get(i);
				strings[i] = isNullCell(cell) ? null : cell;
			}
			return new StringColumnValues(descriptor, strings);
		default:
			throw new IllegalStateException("Unknown type: " + descriptor.getType());
		}
	}

	/**
	 * Build a table from a header and data rows, inferring each column type
	 *
	 * @param header the column names
	 * @param rows   the data rows. Rows shorter than the header are padded with NULL
	 * @return the table
	 */
	public static CcfTable toTable(List<String> header, List<List<String>> rows)
	{
		List<ColumnDescriptor> columns = new ArrayList<>(header.size());
		for (int col = 0; col < header.size(); col++)
		{
			columns.add(new ColumnDescriptor(header.get(col), inferType(columnCells(rows, col))));
		}
		return toTable(new CcfSchema(columns), rows);
	}

	/**
	 * Build a table with an explicit schema
	 *
	 * @param schema the schema
	 * @param rows   the data rows. Rows shorter than the schema are padded with NULL, extra cells are ignored
	 * @return the table
	 */
	public static CcfTable toTable(CcfSchema schema, List<List<String>> rows)
	{
		List<ColumnValues> columns = new ArrayList<>(schema.getNumColumns());
		for (int col = 0; col < schema.getNumColumns(); col++)
		{
			columns.add(toColumnValues(schema.getColumn(col), columnCells(rows, col)));
		}
		return new CcfTable(rows.size(), columns);
	}

	/**
	 * Format a value as text. NULL is the empty string, doubles use the shortest form that parses back to the same
	 * value.
	 *
	 * @param column the column
	 * @param row    the row
	 * @return the text
	 */
	public static String format(ColumnValues column, int row)
	{
		if (column.isNull(row))
			return "";
		return String.valueOf(column.getValue(row));
	}

	/**
	 * @param table the table
	 * @param row   the row
	 * @return the formatted cells of the row in column order
	 */
	public static List<String> formatRow(CcfTable table, int row)
	{
		List<String> cells = new ArrayList<>(table.getColumns().size());
		for (ColumnValues column : table.getColumns())
		{
			cells.add(format(column, row));
		}
		return Collections.unmodifiableList(cells);
	}

	private static List<String> columnCells(List<List<String>> rows, int col)
	{
		List<String> cells = new ArrayList<>(rows.size());
		for (List<String> row : rows)
		{
			cells.add(col < row.size() ? row.get(col) : null);
		}
		return cells;
	}

	private static boolean isNullCell(String cell)
	{
		return cell == null || cell.isEmpty();
	}
}
