package com.earnix.ccf.writer.columnblock;

import java.util.Iterator;
import java.util.PrimitiveIterator;

public class NullableIterators
{
	static <T> ObjectIteratorWrapper<T> wrapObjectIterator(Iterator<T> it)
	{
		return new ObjectIteratorWrapper<>(it);
	}

	static class ObjectIteratorWrapper<T> implements NullableObjectIterator<T>
	{
		private final Iterator<T> it;
		private T val;

		public ObjectIteratorWrapper(Iterator<T> it)
		{
			this.it = it;
		}

		@Override
		public T getValue()
		{
			return val;
		}

		@Override
		public boolean next()
		{
			if (it.hasNext())
			{
				val = it.next();
				return true;
			}
			return false;
		}

		@Override
		public boolean isNull()
		{
			return val == null;
		}
	}

	static NullableIntegerIterator wrapIntegerIterator(PrimitiveIterator.OfInt it)
	{
		return new IntegerIteratorWrapper(it);
	}

	static class IntegerIteratorWrapper extends BaseIteratorWrapper implements NullableIntegerIterator
	{
		private final PrimitiveIterator.OfInt it;
		private int val;

		public IntegerIteratorWrapper(PrimitiveIterator.OfInt it)
		{
			this.it = it;
		}

		@Override
		public int getValue()
		{
			return val;
		}

		@Override
		public boolean next()
		{
			if (it.hasNext())
			{
				val = it.nextInt();
				return true;
			}
			return false;
		}
	}

	/**
	 * Wrap an iterator of boxed integers, null elements being NULL rows
	 */
	static NullableIntegerIterator wrapBoxedIntegerIterator(Iterator<Integer> it)
	{
		ObjectIteratorWrapper<Integer> wrapped = wrapObjectIterator(it);
		return new NullableIntegerIterator()
		{
			@Override
			public int getValue()
			{
				return wrapped.getValue();
			}

			@Override
			public boolean isNull()
			{
				return wrapped.isNull();
			}

			@Override
			public boolean next()
			{
				return wrapped.next();
			}
		};
	}

	static NullableDoubleIterator wrapDoubleIterator(PrimitiveIterator.OfDouble it)
	{
		return new DoubleIteratorWrapper(it);
	}

	static class DoubleIteratorWrapper extends BaseIteratorWrapper implements NullableDoubleIterator
	{
		private final PrimitiveIterator.OfDouble it;
		private double val;

		public DoubleIteratorWrapper(PrimitiveIterator.OfDouble it)
		{
			this.it = it;
		}

		@Override
		public double getValue()
		{
			return val;
		}

		@Override
		public boolean next()
		{
			if (it.hasNext())
			{
				val = it.nextDouble();
				return true;
			}
			return false;
		}
	}

	/**
	 * Wrap an iterator of boxed doubles, null elements being NULL rows
	 */
	static NullableDoubleIterator wrapBoxedDoubleIterator(Iterator<Double> it)
	{
		ObjectIteratorWrapper<Double> wrapped = wrapObjectIterator(it);
		return new NullableDoubleIterator()
		{
			@Override
			public double getValue()
			{
				return wrapped.getValue();
			}

			@Override
			public boolean isNull()
			{
				return wrapped.isNull();
			}

			@Override
			public boolean next()
			{
				return wrapped.next();
			}
		};
	}

	static abstract class BaseIteratorWrapper implements NullableIterator
	{
		@Override
		public boolean isNull()
		{
			return false;
		}
	}

	public interface NullableIterator
	{
		/**
		 * Returns whether the current value is null
		 *
		 * @return whether the current value is null
		 */
		boolean isNull();

		/**
		 * Iterator to the next element
		 *
		 * @return whether the next element exists
		 */
		boolean next();
	}

	public interface NullableDoubleIterator extends NullableIterator
	{
		double getValue();
	}

	public interface NullableIntegerIterator extends NullableIterator
	{
		int getValue();
	}

	public interface NullableObjectIterator<T> extends NullableIterator
	{
		T getValue();
	}
}
