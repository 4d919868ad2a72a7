package com.earnix.ccf.utils;

import org.apache.commons.io.output.UnsynchronizedByteArrayOutputStream;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Appends fixed-width little-endian scalars to an in-memory buffer. Unsigned values are range checked so that a value
 * can never silently wrap into a different one on disk.
 */
public class LittleEndianWriter
{
	private static final long MAX_UINT32 = 0xFFFF_FFFFL;

	private final UnsynchronizedByteArrayOutputStream out = UnsynchronizedByteArrayOutputStream.builder().get();
	private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);

	public LittleEndianWriter writeUnsignedByte(int value)
	{
		checkRange(value, 0xFF, "uint8");
		out.write(value);
		return this;
	}

	public LittleEndianWriter writeUnsignedShort(int value)
	{
		checkRange(value, 0xFFFF, "uint16");
		scratch.clear();
		scratch.putShort((short) value);
		return flushScratch();
	}

	public LittleEndianWriter writeUnsignedInt(long value)
	{
		checkRange(value, MAX_UINT32, "uint32");
		scratch.clear();
		scratch.putInt((int) value);
		return flushScratch();
	}

	/**
	 * @param value a non-negative value. Lengths and offsets above {@link Long#MAX_VALUE} cannot be produced in Java.
	 * @return this writer
	 */
	public LittleEndianWriter writeUnsignedLong(long value)
	{
		checkRange(value, Long.MAX_VALUE, "uint64");
		scratch.clear();
		scratch.putLong(value);
		return flushScratch();
	}

	public LittleEndianWriter writeInt(int value)
	{
		scratch.clear();
		scratch.putInt(value);
		return flushScratch();
	}

	/**
	 * Write the raw IEEE-754 bits of the value. NaN payloads are kept as is.
	 *
	 * @param value the value to write
	 * @return this writer
	 */
	public LittleEndianWriter writeDouble(double value)
	{
		scratch.clear();
		scratch.putLong(Double.doubleToRawLongBits(value));
		return flushScratch();
	}

	public LittleEndianWriter writeBytes(byte[] bytes)
	{
		out.write(bytes, 0, bytes.length);
		return this;
	}

	public int size()
	{
		return out.size();
	}

	public byte[] toByteArray()
	{
		return out.toByteArray();
	}

	/**
	 * Overwrite a uint32 at an absolute position of an already serialized buffer
	 *
	 * @param dest     the serialized bytes
	 * @param position the position of the field
	 * @param value    the value to write
	 */
	public static void patchUnsignedInt(byte[] dest, int position, long value)
	{
		checkRange(value, MAX_UINT32, "uint32");
		ByteBuffer.wrap(dest, position, Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value);
	}

	/**
	 * Encode a string as UTF-8 without replacement characters
	 *
	 * @param s the string to encode
	 * @return the UTF-8 bytes
	 * @throws IllegalArgumentException if the string holds an unpaired surrogate
	 */
	public static byte[] encodeUtf8(String s)
	{
		CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try
		{
			ByteBuffer encoded = encoder.encode(CharBuffer.wrap(s));
			byte[] ret = new byte[encoded.remaining()];
			encoded.get(ret);
			return ret;
		}
		catch (CharacterCodingException ex)
		{
			throw new IllegalArgumentException("String is not encodable as UTF-8: " + ex.getMessage(), ex);
		}
	}

	private LittleEndianWriter flushScratch()
	{
		out.write(scratch.array(), 0, scratch.position());
		return this;
	}

	private static void checkRange(long value, long max, String type)
	{
		if (value < 0 || value > max)
			throw new IllegalArgumentException("Value " + value + " out of range for " + type);
	}
}
