package com.earnix.ccf.utils;

import com.earnix.ccf.CcfException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reads fixed-width little-endian scalars from a byte region. Every read checks the remaining length first and fails
 * with {@link CcfException.TruncatedInput} instead of reading past the region.
 */
public class LittleEndianReader
{
	private final ByteBuffer buf;
	private final String regionName;

	/**
	 * @param data       the bytes to read
	 * @param regionName name of the region used in error messages, e.g. "header" or "column block id"
	 */
	public LittleEndianReader(byte[] data, String regionName)
	{
		this(ByteBuffer.wrap(data), regionName);
	}

	public LittleEndianReader(ByteBuffer buf, String regionName)
	{
		this.buf = buf.slice().order(ByteOrder.LITTLE_ENDIAN);
		this.regionName = regionName;
	}

	public int readUnsignedByte() throws CcfException.TruncatedInput
	{
		requireRemaining(Byte.BYTES, "uint8");
		return Byte.toUnsignedInt(buf.get());
	}

	public int readUnsignedShort() throws CcfException.TruncatedInput
	{
		requireRemaining(Short.BYTES, "uint16");
		return Short.toUnsignedInt(buf.getShort());
	}

	public long readUnsignedInt() throws CcfException.TruncatedInput
	{
		requireRemaining(Integer.BYTES, "uint32");
		return Integer.toUnsignedLong(buf.getInt());
	}

	/**
	 * Read a uint64. Java has no unsigned long, so values above {@link Long#MAX_VALUE} are returned negative and must
	 * be rejected by the caller where a length or offset is expected.
	 *
	 * @return the raw 64 bits
	 * @throws CcfException.TruncatedInput if fewer than 8 bytes remain
	 */
	public long readUnsignedLong() throws CcfException.TruncatedInput
	{
		requireRemaining(Long.BYTES, "uint64");
		return buf.getLong();
	}

	public int readInt() throws CcfException.TruncatedInput
	{
		requireRemaining(Integer.BYTES, "int32");
		return buf.getInt();
	}

	public double readDouble() throws CcfException.TruncatedInput
	{
		requireRemaining(Double.BYTES, "float64");
		return Double.longBitsToDouble(buf.getLong());
	}

	public byte[] readBytes(int len) throws CcfException.TruncatedInput
	{
		requireRemaining(len, len + " bytes");
		byte[] ret = new byte[len];
		buf.get(ret);
		return ret;
	}

	/**
	 * @return a view of the unread bytes. Does not advance this reader.
	 */
	public ByteBuffer remainingSlice()
	{
		return buf.slice();
	}

	public void skip(int len) throws CcfException.TruncatedInput
	{
		requireRemaining(len, len + " bytes");
		buf.position(buf.position() + len);
	}

	public int remaining()
	{
		return buf.remaining();
	}

	public int position()
	{
		return buf.position();
	}

	public String getRegionName()
	{
		return regionName;
	}

	private void requireRemaining(int width, String what) throws CcfException.TruncatedInput
	{
		if (width < 0 || buf.remaining() < width)
		{
			throw new CcfException.TruncatedInput(
					"Expected " + what + " at position " + buf.position() + " of " + regionName + " but only "
							+ buf.remaining() + " bytes remain");
		}
	}

	/**
	 * Strictly decode UTF-8 bytes. Malformed input is reported rather than replaced.
	 *
	 * @param bytes the bytes to decode
	 * @return the decoded string
	 * @throws CharacterCodingException on malformed or unmappable input
	 */
	public static String decodeUtf8(ByteBuffer bytes) throws CharacterCodingException
	{
		CharBuffer chars = StandardCharsets.UTF_8.newDecoder()//
				.onMalformedInput(CodingErrorAction.REPORT)//
				.onUnmappableCharacter(CodingErrorAction.REPORT)//
				.decode(bytes);
		return chars.toString();
	}
}
