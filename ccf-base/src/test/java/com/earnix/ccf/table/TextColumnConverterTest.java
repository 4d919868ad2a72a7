package com.earnix.ccf.table;

import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class TextColumnConverterTest
{
	@Test
	public void inferType()
	{
		Assert.assertEquals(DataType.INT32, TextColumnConverter.inferType(Arrays.asList("1", "", "-42")));
		Assert.assertEquals(DataType.FLOAT64, TextColumnConverter.inferType(Arrays.asList("1", "2.5", "")));
		Assert.assertEquals(DataType.FLOAT64, TextColumnConverter.inferType(Arrays.asList("1e3", "3")));
		Assert.assertEquals(DataType.UTF8_STRING, TextColumnConverter.inferType(Arrays.asList("1", "2.5", "x")));
		// too large for 32 bits
		Assert.assertEquals(DataType.FLOAT64, TextColumnConverter.inferType(Arrays.asList("3000000000")));
		Assert.assertEquals(DataType.INT32, TextColumnConverter.inferType(Arrays.asList("", "")));
		Assert.assertEquals(DataType.INT32, TextColumnConverter.inferType(List.of()));
	}

	@Test
	public void parseTypeName()
	{
		Assert.assertEquals(DataType.INT32, TextColumnConverter.parseTypeName("int"));
		Assert.assertEquals(DataType.INT32, TextColumnConverter.parseTypeName("int32"));
		Assert.assertEquals(DataType.FLOAT64, TextColumnConverter.parseTypeName("float"));
		Assert.assertEquals(DataType.FLOAT64, TextColumnConverter.parseTypeName("float64"));
		Assert.assertEquals(DataType.UTF8_STRING, TextColumnConverter.parseTypeName("str"));
		Assert.assertEquals(DataType.UTF8_STRING, TextColumnConverter.parseTypeName("date"));
	}

	@Test
	public void toTableInfersAndPads()
	{
		List<String> header = Arrays.asList("id", "score", "name");
		List<List<String>> rows = Arrays.asList(Arrays.asList("1", "9.5", "alice"), Arrays.asList("2", "", "bob"),
				Arrays.asList("3"));
		CcfTable table = TextColumnConverter.toTable(header, rows);

		Assert.assertEquals(3, table.getNumRows());
		Assert.assertEquals(CcfSchema.of(new ColumnDescriptor("id", DataType.INT32),
				new ColumnDescriptor("score", DataType.FLOAT64), new ColumnDescriptor("name", DataType.UTF8_STRING)),
				table.getSchema());
		Assert.assertEquals(Arrays.asList(2, null, "bob"), table.getRow(1));
		Assert.assertEquals(Arrays.asList(3, null, null), table.getRow(2));
	}

	@Test
	public void explicitSchema()
	{
		CcfSchema schema = CcfSchema.of(new ColumnDescriptor("a", DataType.FLOAT64),
				new ColumnDescriptor("b", DataType.UTF8_STRING));
		CcfTable table = TextColumnConverter.toTable(schema, List.of(Arrays.asList("7", "007")));
		Assert.assertEquals(Arrays.asList(7.0, "007"), table.getRow(0));
	}

	@Test
	public void unparsableCell()
	{
		ColumnDescriptor desc = new ColumnDescriptor("a", DataType.INT32);
		Assert.assertThrows(IllegalArgumentException.class,
				() -> TextColumnConverter.toColumnValues(desc, Arrays.asList("1", "1.5")));
	}

	@Test
	public void format()
	{
		CcfTable table = CcfTable.of(IntColumnValues.of("i", -3, null), DoubleColumnValues.of("d", 0.1, 2.0),
				StringColumnValues.of("s", "", "x"));
		Assert.assertEquals(Arrays.asList("-3", "0.1", ""), TextColumnConverter.formatRow(table, 0));
		Assert.assertEquals(Arrays.asList("", "2.0", "x"), TextColumnConverter.formatRow(table, 1));
	}
}
