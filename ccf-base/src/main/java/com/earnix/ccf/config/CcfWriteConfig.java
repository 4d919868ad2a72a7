package com.earnix.ccf.config;

import com.earnix.ccf.block.ColumnBlockCodec;
import com.earnix.ccf.compressors.DeflateCompressor;
import com.earnix.ccf.compressors.DeflateDecompressor;

public class CcfWriteConfig
{
	public static final String COMPRESSION_LEVEL_PROPERTY = "com.earnix.ccf.compression.deflatelevel";
	public static final int DEFAULT_COMPRESSION_LEVEL = 6;

	private final int deflateCompressionLevel;

	/**
	 * Default config. The deflate level may be overridden with the {@value #COMPRESSION_LEVEL_PROPERTY} system
	 * property.
	 */
	public CcfWriteConfig()
	{
		this(Integer.parseInt(
				System.getProperty(COMPRESSION_LEVEL_PROPERTY, String.valueOf(DEFAULT_COMPRESSION_LEVEL))));
	}

	public CcfWriteConfig(int deflateCompressionLevel)
	{
		this.deflateCompressionLevel = deflateCompressionLevel;
	}

	public int getDeflateCompressionLevel()
	{
		return deflateCompressionLevel;
	}

	/**
	 * @return a block codec compressing at the configured level
	 */
	public ColumnBlockCodec createBlockCodec()
	{
		return new ColumnBlockCodec(new DeflateCompressor(deflateCompressionLevel), new DeflateDecompressor());
	}
}
