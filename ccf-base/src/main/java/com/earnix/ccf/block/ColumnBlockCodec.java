package com.earnix.ccf.block;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.compressors.Compressor;
import com.earnix.ccf.compressors.Decompressor;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.table.ColumnValues;
import com.earnix.ccf.table.DoubleColumnValues;
import com.earnix.ccf.table.IntColumnValues;
import com.earnix.ccf.table.StringColumnValues;
import com.earnix.ccf.utils.LittleEndianReader;
import com.earnix.ccf.utils.LittleEndianWriter;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.Arrays;

/**
 * Encodes one column into a block and back.
 * <p>
 * Uncompressed block layout: {@code NULL_BITMAP_LEN(u32) | NULL_BITMAP | TYPED_PAYLOAD}. The payload has one slot per
 * row whether or not the row is NULL, so row i is always slot i:
 * <ul>
 * <li>INT32 / FLOAT64: N fixed-width values, 0 in NULL rows</li>
 * <li>UTF8_STRING: N + 1 uint32 offsets followed by the concatenated UTF-8 bytes, NULL rows are empty slices</li>
 * </ul>
 * The whole uncompressed block is then compressed.
 */
public class ColumnBlockCodec
{
	private final Compressor compressor;
	private final Decompressor decompressor;

	public ColumnBlockCodec(Compressor compressor, Decompressor decompressor)
	{
		this.compressor = compressor;
		this.decompressor = decompressor;
	}

	public ColumnBlock encode(ColumnValues values)
	{
		byte[] uncompressed = serialize(values);
		byte[] compressed = new byte[compressor.maxCompressedLength(uncompressed.length)];
		int compressedSize = compressor.compress(uncompressed, compressed);
		return new ColumnBlock(values.getDescriptor(), values.getNumRows(), Arrays.copyOf(compressed, compressedSize),
				uncompressed.length);
	}

	/**
	 * @param values the column
	 * @return the uncompressed block
	 */
	public static byte[] serialize(ColumnValues values)
	{
		LittleEndianWriter writer = new LittleEndianWriter();
		NullBitmapCodec.write(writer, values.getNullMask());
		switch (values.getDescriptor().getType())
		{
		case INT32:
			writeInts(writer, (IntColumnValues) values);
			break;
		case FLOAT64:
			writeDoubles(writer, (DoubleColumnValues) values);
			break;
		case UTF8_STRING:
			writeStrings(writer, (StringColumnValues) values);
			break;
		default:
			throw new IllegalStateException("Unsupported type: " + values.getDescriptor().getType());
		}
		return writer.toByteArray();
	}

	private static void writeInts(LittleEndianWriter writer, IntColumnValues values)
	{
		for (int i = 0; i < values.getNumRows(); i++)
		{
			writer.writeInt(values.isNull(i) ? 0 : values.getInteger(i));
		}
	}

	private static void writeDoubles(LittleEndianWriter writer, DoubleColumnValues values)
	{
		for (int i = 0; i < values.getNumRows(); i++)
		{
			writer.writeDouble(values.isNull(i) ? 0d : values.getDouble(i));
		}
	}

	private static void writeStrings(LittleEndianWriter writer, StringColumnValues values)
	{
		int numRows = values.getNumRows();
		byte[][] encoded = new byte[numRows][];
		long offset = 0;
		writer.writeUnsignedInt(0);
		for (int i = 0; i < numRows; i++)
		{
			encoded[i] = values.isNull(i) ? new byte[0] : LittleEndianWriter.encodeUtf8(values.getString(i));
			offset += encoded[i].length;
			writer.writeUnsignedInt(offset);
		}
		for (byte[] bytes : encoded)
		{
			writer.writeBytes(bytes);
		}
	}

	/**
	 * Decompress and parse one block
	 *
	 * @param descriptor       the column the block belongs to
	 * @param compressed       the stored bytes
	 * @param numRows          the file row count
	 * @param uncompressedSize the uncompressed size from the column metadata
	 * @return the column values
	 * @throws CcfException if the block is corrupt, truncated, or does not match the column
	 */
	public ColumnValues decode(ColumnDescriptor descriptor, byte[] compressed, int numRows, long uncompressedSize)
			throws CcfException
	{
		if (uncompressedSize < 0 || uncompressedSize >= Integer.MAX_VALUE)
			throw new CcfException.CorruptBlock(
					"Uncompressed size " + uncompressedSize + " of " + descriptor.getName() + " is not supported");
		byte[] uncompressed = decompressor.decompress(compressed, (int) uncompressedSize);
		return deserialize(descriptor, uncompressed, numRows);
	}

	/**
	 * Parse an uncompressed block
	 *
	 * @param descriptor   the column the block belongs to
	 * @param uncompressed the uncompressed block
	 * @param numRows      the file row count
	 * @return the column values
	 * @throws CcfException if the block is truncated or inconsistent
	 */
	public static ColumnValues deserialize(ColumnDescriptor descriptor, byte[] uncompressed, int numRows)
			throws CcfException
	{
		LittleEndianReader reader = new LittleEndianReader(uncompressed, "column block " + descriptor.getName());
		boolean[] nulls = NullBitmapCodec.read(reader, numRows);
		if (descriptor.getType().isFixedWidth())
			checkFixedWidthPayload(descriptor, reader.remaining(), numRows);
		ColumnValues ret;
		switch (descriptor.getType())
		{
		case INT32:
			ret = readInts(descriptor, reader, nulls);
			break;
		case FLOAT64:
			ret = readDoubles(descriptor, reader, nulls);
			break;
		case UTF8_STRING:
			ret = readStrings(descriptor, reader, nulls);
			break;
		default:
			throw new IllegalStateException("Unsupported type: " + descriptor.getType());
		}
		if (reader.remaining() != 0)
			throw new CcfException.CorruptBlock(
					reader.remaining() + " unexpected trailing bytes in column block " + descriptor.getName());
		return ret;
	}

	private static void checkFixedWidthPayload(ColumnDescriptor descriptor, int payloadLen, int numRows)
			throws CcfException
	{
		long expected = (long) numRows * descriptor.getType().getFixedWidth();
		if (payloadLen < expected)
			throw new CcfException.TruncatedInput(
					"Payload of " + descriptor.getName() + " has " + payloadLen + " bytes, expected " + expected);
		if (payloadLen > expected)
			throw new CcfException.CorruptBlock(
					(payloadLen - expected) + " unexpected trailing bytes in column block " + descriptor.getName());
	}

	private static IntColumnValues readInts(ColumnDescriptor descriptor, LittleEndianReader reader, boolean[] nulls)
			throws CcfException.TruncatedInput
	{
		int[] values = new int[nulls.length];
		for (int i = 0; i < values.length; i++)
		{
			values[i] = reader.readInt();
		}
		return new IntColumnValues(descriptor, values, nulls);
	}

	private static DoubleColumnValues readDoubles(ColumnDescriptor descriptor, LittleEndianReader reader,
			boolean[] nulls) throws CcfException.TruncatedInput
	{
		double[] values = new double[nulls.length];
		for (int i = 0; i < values.length; i++)
		{
			values[i] = reader.readDouble();
		}
		return new DoubleColumnValues(descriptor, values, nulls);
	}

	private static StringColumnValues readStrings(ColumnDescriptor descriptor, LittleEndianReader reader,
			boolean[] nulls) throws CcfException
	{
		int numRows = nulls.length;
		long[] offsets = new long[numRows + 1];
		for (int i = 0; i <= numRows; i++)
		{
			offsets[i] = reader.readUnsignedInt();
		}
		validateOffsets(descriptor, offsets, reader.remaining());

		ByteBuffer data = reader.remainingSlice();
		String[] values = new String[numRows];
		for (int i = 0; i < numRows; i++)
		{
			if (nulls[i])
				continue;
			ByteBuffer slice = data.duplicate();
			slice.limit((int) offsets[i + 1]).position((int) offsets[i]);
			try
			{
				values[i] = LittleEndianReader.decodeUtf8(slice);
			}
			catch (CharacterCodingException ex)
			{
				throw new CcfException.CorruptBlock(
						"Row " + i + " of " + descriptor.getName() + " is not valid UTF-8", ex);
			}
		}
		reader.skip(reader.remaining());
		return new StringColumnValues(descriptor, values);
	}

	private static void validateOffsets(ColumnDescriptor descriptor, long[] offsets, int dataLen)
			throws CcfException.CorruptBlock
	{
		if (offsets[0] != 0)
			throw new CcfException.CorruptBlock(
					"String offsets of " + descriptor.getName() + " start at " + offsets[0] + " instead of 0");
		for (int i = 1; i < offsets.length; i++)
		{
			if (offsets[i] < offsets[i - 1])
				throw new CcfException.CorruptBlock(
						"String offsets of " + descriptor.getName() + " decrease at row " + (i - 1));
		}
		long end = offsets[offsets.length - 1];
		if (end != dataLen)
			throw new CcfException.CorruptBlock(
					"String offsets of " + descriptor.getName() + " end at " + end + " but " + dataLen
							+ " string bytes are stored");
	}
}
