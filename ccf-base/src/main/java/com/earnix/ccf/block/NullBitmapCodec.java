package com.earnix.ccf.block;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.utils.LittleEndianReader;
import com.earnix.ccf.utils.LittleEndianWriter;
import com.google.common.math.IntMath;

import java.math.RoundingMode;

/**
 * Per-row validity bitmap. Bit i (LSB first within byte i / 8) is set iff row i is NULL. Bits past the last row are
 * written as zero and ignored when read.
 */
public class NullBitmapCodec
{
	private NullBitmapCodec()
	{
	}

	/**
	 * @param numRows number of rows
	 * @return the number of bytes of a bitmap for numRows rows
	 */
	public static int bitmapLength(int numRows)
	{
		return IntMath.divide(numRows, Byte.SIZE, RoundingMode.CEILING);
	}

	public static byte[] encode(boolean[] nulls)
	{
		byte[] bitmap = new byte[bitmapLength(nulls.length)];
		for (int i = 0; i < nulls.length; i++)
		{
			if (nulls[i])
				bitmap[i >>> 3] |= (byte) (1 << (i & 7));
		}
		return bitmap;
	}

	/**
	 * @param bitmap  the bitmap bytes
	 * @param numRows number of rows the bitmap covers
	 * @return the null mask
	 * @throws CcfException.TruncatedInput if the bitmap is shorter than needed for numRows
	 */
	public static boolean[] decode(byte[] bitmap, int numRows) throws CcfException.TruncatedInput
	{
		if (bitmap.length < bitmapLength(numRows))
			throw new CcfException.TruncatedInput(
					"Null bitmap of " + bitmap.length + " bytes cannot hold " + numRows + " rows");
		boolean[] nulls = new boolean[numRows];
		for (int i = 0; i < numRows; i++)
		{
			nulls[i] = (bitmap[i >>> 3] & (1 << (i & 7))) != 0;
		}
		return nulls;
	}

	/**
	 * Write the NULL_BITMAP_LEN field followed by the bitmap
	 *
	 * @param writer destination
	 * @param nulls  the null mask
	 */
	public static void write(LittleEndianWriter writer, boolean[] nulls)
	{
		byte[] bitmap = encode(nulls);
		writer.writeUnsignedInt(bitmap.length);
		writer.writeBytes(bitmap);
	}

	/**
	 * Read the NULL_BITMAP_LEN field and the bitmap it announces
	 *
	 * @param reader  source positioned at NULL_BITMAP_LEN
	 * @param numRows the row count of the block
	 * @return the null mask
	 * @throws CcfException.SchemaMismatch if the stored length is not the length this version uses for numRows
	 * @throws CcfException.TruncatedInput if the block ends inside the bitmap
	 */
	public static boolean[] read(LittleEndianReader reader, int numRows) throws CcfException
	{
		long declaredLen = reader.readUnsignedInt();
		int expectedLen = bitmapLength(numRows);
		if (declaredLen != expectedLen)
			throw new CcfException.SchemaMismatch(
					"Null bitmap of " + reader.getRegionName() + " declares " + declaredLen + " bytes, expected "
							+ expectedLen + " for " + numRows + " rows");
		return decode(reader.readBytes(expectedLen), numRows);
	}
}
