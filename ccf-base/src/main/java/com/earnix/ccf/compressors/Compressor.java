package com.earnix.ccf.compressors;

/**
 * Compresses a whole uncompressed column block in one call
 */
public interface Compressor
{
	/**
	 * @param input  the uncompressed block
	 * @param output destination, at least {@link #maxCompressedLength(int)} bytes long
	 * @return the number of bytes written to output
	 */
	int compress(byte[] input, byte[] output);

	/**
	 * @param uncompressedLength length of the uncompressed block
	 * @return an upper bound of the compressed length
	 */
	int maxCompressedLength(int uncompressedLength);
}
