package com.earnix.ccf.block;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import com.earnix.ccf.table.ColumnValues;
import com.earnix.ccf.table.DoubleColumnValues;
import com.earnix.ccf.table.IntColumnValues;
import com.earnix.ccf.table.StringColumnValues;
import com.earnix.ccf.utils.LittleEndianWriter;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class ColumnBlockCodecTest
{
	private final ColumnBlockCodec codec = new CcfWriteConfig(CcfWriteConfig.DEFAULT_COMPRESSION_LEVEL)
			.createBlockCodec();

	@Test
	public void intLayout()
	{
		byte[] block = ColumnBlockCodec.serialize(IntColumnValues.of("x", 5, null, -1));
		byte[] expected = new LittleEndianWriter()//
				.writeUnsignedInt(1)//
				.writeUnsignedByte(0b010)//
				.writeInt(5)//
				.writeInt(0)//
				.writeInt(-1)//
				.toByteArray();
		Assert.assertArrayEquals(expected, block);
	}

	@Test
	public void stringLayout()
	{
		byte[] block = ColumnBlockCodec.serialize(StringColumnValues.of("s", "ab", null, "", "é"));
		byte[] expected = new LittleEndianWriter()//
				.writeUnsignedInt(1)//
				.writeUnsignedByte(0b0010)//
				.writeUnsignedInt(0)//
				.writeUnsignedInt(2)//
				.writeUnsignedInt(2)//
				.writeUnsignedInt(2)//
				.writeUnsignedInt(4)//
				.writeBytes(new byte[] { 'a', 'b', (byte) 0xC3, (byte) 0xA9 })//
				.toByteArray();
		Assert.assertArrayEquals(expected, block);
	}

	@Test
	public void encodeDecodeKeepsNullAndEmptyApart() throws Exception
	{
		StringColumnValues values = StringColumnValues.of("s", "", null, "x", null, "");
		ColumnBlock block = codec.encode(values);
		ColumnValues decoded = codec.decode(values.getDescriptor(), block.getCompressedBytes(), 5,
				block.getUncompressedSize());
		Assert.assertEquals(values, decoded);
		Assert.assertEquals("", decoded.getValue(0));
		Assert.assertTrue(decoded.isNull(1));
		Assert.assertNull(decoded.getValue(1));
	}

	@Test
	public void allNullDoubles() throws Exception
	{
		DoubleColumnValues values = DoubleColumnValues.of("d", null, null, null);
		ColumnBlock block = codec.encode(values);
		Assert.assertEquals(4 + 1 + 3 * 8, block.getUncompressedSize());
		ColumnValues decoded = codec.decode(values.getDescriptor(), block.getCompressedBytes(), 3,
				block.getUncompressedSize());
		Assert.assertEquals(Arrays.asList(null, null, null), decoded.toList());
	}

	@Test
	public void zeroRows() throws Exception
	{
		ColumnDescriptor desc = new ColumnDescriptor("s", DataType.UTF8_STRING);
		ColumnBlock block = codec.encode(new StringColumnValues(desc, new String[0]));
		// bitmap length plus the single offset
		Assert.assertEquals(8, block.getUncompressedSize());
		ColumnValues decoded = codec.decode(desc, block.getCompressedBytes(), 0, block.getUncompressedSize());
		Assert.assertEquals(0, decoded.getNumRows());
	}

	@Test
	public void wrongUncompressedSize() throws Exception
	{
		IntColumnValues values = IntColumnValues.of("x", 1, 2, 3);
		ColumnBlock block = codec.encode(values);

		CcfException.UncompressedSizeMismatch tooBig = Assert.assertThrows(
				CcfException.UncompressedSizeMismatch.class,
				() -> codec.decode(values.getDescriptor(), block.getCompressedBytes(), 3,
						block.getUncompressedSize() + 1));
		Assert.assertEquals(CcfException.ErrorKind.CORRUPT_BLOCK, tooBig.getKind());
		Assert.assertEquals(block.getUncompressedSize() + 1, tooBig.getDeclaredSize());

		Assert.assertThrows(CcfException.UncompressedSizeMismatch.class,
				() -> codec.decode(values.getDescriptor(), block.getCompressedBytes(), 3,
						block.getUncompressedSize() - 1));
	}

	@Test
	public void hugeDeclaredSizeIsCorruptBlock()
	{
		IntColumnValues values = IntColumnValues.of("x", 1, 2, 3);
		ColumnBlock block = codec.encode(values);

		CcfException.UncompressedSizeMismatch ex = Assert.assertThrows(CcfException.UncompressedSizeMismatch.class,
				() -> codec.decode(values.getDescriptor(), block.getCompressedBytes(), 3, Integer.MAX_VALUE - 1));
		Assert.assertEquals(CcfException.ErrorKind.CORRUPT_BLOCK, ex.getKind());
		Assert.assertEquals(block.getUncompressedSize(), ex.getActualSize());
	}

	@Test
	public void garbageIsCorruptBlock()
	{
		ColumnDescriptor desc = new ColumnDescriptor("x", DataType.INT32);
		Assert.assertThrows(CcfException.CorruptBlock.class,
				() -> codec.decode(desc, new byte[] { 1, 2, 3, 4, 5, 6, 7 }, 1, 9));
	}

	@Test
	public void truncatedCompressedBytes()
	{
		IntColumnValues values = IntColumnValues.of("x", 1, 2, 3, 4, 5, 6, 7, 8);
		ColumnBlock block = codec.encode(values);
		byte[] cut = Arrays.copyOf(block.getCompressedBytes(), (int) block.getCompressedSize() - 3);
		Assert.assertThrows(CcfException.CorruptBlock.class,
				() -> codec.decode(values.getDescriptor(), cut, 8, block.getUncompressedSize()));
	}

	@Test
	public void trailingPayloadBytes()
	{
		ColumnDescriptor desc = new ColumnDescriptor("x", DataType.INT32);
		byte[] block = new LittleEndianWriter().writeUnsignedInt(1).writeUnsignedByte(0).writeInt(1).writeInt(2)
				.toByteArray();
		Assert.assertThrows(CcfException.CorruptBlock.class, () -> ColumnBlockCodec.deserialize(desc, block, 1));
	}

	@Test
	public void shortPayloadIsTruncated()
	{
		ColumnDescriptor desc = new ColumnDescriptor("d", DataType.FLOAT64);
		byte[] block = new LittleEndianWriter().writeUnsignedInt(1).writeUnsignedByte(0).writeDouble(1).toByteArray();
		Assert.assertThrows(CcfException.TruncatedInput.class, () -> ColumnBlockCodec.deserialize(desc, block, 2));
	}

	@Test
	public void payloadLengthFollowsTypeWidth()
	{
		// two int slots are one double short of two doubles
		byte[] block = ColumnBlockCodec.serialize(IntColumnValues.of("x", 1, 2));
		ColumnDescriptor asDoubles = new ColumnDescriptor("x", DataType.FLOAT64);
		Assert.assertThrows(CcfException.TruncatedInput.class,
				() -> ColumnBlockCodec.deserialize(asDoubles, block, 2));

		byte[] doubles = ColumnBlockCodec.serialize(DoubleColumnValues.of("d", 1.0, 2.0));
		ColumnDescriptor asInts = new ColumnDescriptor("d", DataType.INT32);
		Assert.assertThrows(CcfException.CorruptBlock.class, () -> ColumnBlockCodec.deserialize(asInts, doubles, 2));
	}

	@Test
	public void unpairedSurrogateIsRejected()
	{
		Assert.assertThrows(IllegalArgumentException.class,
				() -> codec.encode(StringColumnValues.of("s", "a\uD800b")));
		Assert.assertThrows(IllegalArgumentException.class,
				() -> ColumnBlockCodec.serialize(StringColumnValues.of("s", "ok", "\uDC00")));
	}

	@Test
	public void badStringOffsets()
	{
		ColumnDescriptor desc = new ColumnDescriptor("s", DataType.UTF8_STRING);
		byte[] decreasing = new LittleEndianWriter().writeUnsignedInt(1).writeUnsignedByte(0)//
				.writeUnsignedInt(0).writeUnsignedInt(2).writeUnsignedInt(1)//
				.writeBytes(new byte[] { 'a', 'b' }).toByteArray();
		Assert.assertThrows(CcfException.CorruptBlock.class, () -> ColumnBlockCodec.deserialize(desc, decreasing, 2));

		byte[] pastEnd = new LittleEndianWriter().writeUnsignedInt(1).writeUnsignedByte(0)//
				.writeUnsignedInt(0).writeUnsignedInt(5)//
				.writeBytes(new byte[] { 'a', 'b' }).toByteArray();
		Assert.assertThrows(CcfException.CorruptBlock.class, () -> ColumnBlockCodec.deserialize(desc, pastEnd, 1));
	}

	@Test
	public void invalidUtf8()
	{
		ColumnDescriptor desc = new ColumnDescriptor("s", DataType.UTF8_STRING);
		byte[] block = new LittleEndianWriter().writeUnsignedInt(1).writeUnsignedByte(0)//
				.writeUnsignedInt(0).writeUnsignedInt(1)//
				.writeBytes(new byte[] { (byte) 0xFF }).toByteArray();
		Assert.assertThrows(CcfException.CorruptBlock.class, () -> ColumnBlockCodec.deserialize(desc, block, 1));
	}

	@Test
	public void encodingIsDeterministic()
	{
		DoubleColumnValues values = DoubleColumnValues.of("d", 1.5, null, Double.NaN, -0.0);
		Assert.assertArrayEquals(codec.encode(values).getCompressedBytes(),
				codec.encode(values).getCompressedBytes());
	}
}
