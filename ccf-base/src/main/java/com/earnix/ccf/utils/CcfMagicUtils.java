package com.earnix.ccf.utils;

import com.earnix.ccf.CcfException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A class to store the CCF magic bytes
 */
public class CcfMagicUtils
{
	/**
	 * The CCF magic string, NUL padded to 8 bytes
	 */
	public static final String CCF_MAGIC = "CCFv1\0\0\0";
	private static final byte[] CCF_MAGIC_BYTES = CCF_MAGIC.getBytes(StandardCharsets.US_ASCII);

	public static int magicLength()
	{
		return CCF_MAGIC_BYTES.length;
	}

	public static byte[] magicBytes()
	{
		return CCF_MAGIC_BYTES.clone();
	}

	/**
	 * Read and verify the magic
	 *
	 * @param reader reader positioned at the start of the file
	 * @throws CcfException.BadMagic       if the bytes are not the CCF magic
	 * @throws CcfException.TruncatedInput if fewer bytes than the magic are available
	 */
	public static void expectMagic(LittleEndianReader reader) throws CcfException
	{
		byte[] magic = reader.readBytes(CCF_MAGIC_BYTES.length);
		if (!Arrays.equals(magic, CCF_MAGIC_BYTES))
			throw new CcfException.BadMagic("Bad magic: not a CCF file. Found " + Arrays.toString(magic));
	}
}
