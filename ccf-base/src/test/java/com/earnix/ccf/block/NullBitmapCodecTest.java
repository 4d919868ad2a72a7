package com.earnix.ccf.block;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.utils.LittleEndianReader;
import com.earnix.ccf.utils.LittleEndianWriter;
import org.junit.Assert;
import org.junit.Test;

public class NullBitmapCodecTest
{
	@Test
	public void bitsAreLsbFirst()
	{
		boolean[] nulls = new boolean[10];
		nulls[0] = true;
		nulls[3] = true;
		nulls[9] = true;
		Assert.assertArrayEquals(new byte[] { 0b0000_1001, 0b0000_0010 }, NullBitmapCodec.encode(nulls));
	}

	@Test
	public void bitmapLength()
	{
		Assert.assertEquals(0, NullBitmapCodec.bitmapLength(0));
		Assert.assertEquals(1, NullBitmapCodec.bitmapLength(1));
		Assert.assertEquals(1, NullBitmapCodec.bitmapLength(8));
		Assert.assertEquals(2, NullBitmapCodec.bitmapLength(9));
	}

	@Test
	public void decodeIgnoresTrailingBits() throws Exception
	{
		boolean[] nulls = NullBitmapCodec.decode(new byte[] { (byte) 0b1111_0010 }, 3);
		Assert.assertArrayEquals(new boolean[] { false, true, false }, nulls);
	}

	@Test
	public void decodeTooShort()
	{
		Assert.assertThrows(CcfException.TruncatedInput.class, () -> NullBitmapCodec.decode(new byte[1], 9));
	}

	@Test
	public void readChecksDeclaredLength() throws Exception
	{
		byte[] block = new LittleEndianWriter().writeUnsignedInt(2).writeBytes(new byte[2]).toByteArray();
		CcfException.SchemaMismatch ex = Assert.assertThrows(CcfException.SchemaMismatch.class,
				() -> NullBitmapCodec.read(new LittleEndianReader(block, "block"), 5));
		Assert.assertEquals(CcfException.ErrorKind.SCHEMA_MISMATCH, ex.getKind());

		boolean[] nulls = NullBitmapCodec.read(new LittleEndianReader(block, "block"), 16);
		Assert.assertEquals(16, nulls.length);
	}

	@Test
	public void writeThenRead() throws Exception
	{
		boolean[] nulls = { true, false, false, true, true, false, false, false, true };
		LittleEndianWriter writer = new LittleEndianWriter();
		NullBitmapCodec.write(writer, nulls);
		Assert.assertEquals(4 + 2, writer.size());
		Assert.assertArrayEquals(nulls,
				NullBitmapCodec.read(new LittleEndianReader(writer.toByteArray(), "block"), nulls.length));
	}
}
