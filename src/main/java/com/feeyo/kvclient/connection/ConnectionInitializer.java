package com.feeyo.kvclient.connection;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

import com.feeyo.kvclient.exception.ClientException;
import com.feeyo.kvclient.exception.InvalidInitializerException;

/**
 * Strategy registered for a scheme: either a type constructor, whose connections get
 * prepared by the factory, or a lazy function that receives the factory and is trusted
 * to wire its connection itself.
 */
public abstract class ConnectionInitializer {

	private ConnectionInitializer() {}

	public abstract boolean isLazy();

	public abstract SingleConnection initialize(ConnectionParameters parameters, ConnectionFactory factory);

	public static ConnectionInitializer ofType(final ConnectionConstructor constructor) {
		if (constructor == null) {
			throw new InvalidInitializerException("A connection initializer must not be null");
		}
		return new TypeInitializer(constructor, constructor.toString());
	}

	public static ConnectionInitializer lazy(final LazyConnectionInitializer function) {
		if (function == null) {
			throw new InvalidInitializerException("A connection initializer must not be null");
		}
		return new LazyInitializer(function);
	}

	/**
	 * Adapts a concrete {@link SingleConnection} class exposing a public
	 * {@code (ConnectionParameters)} constructor.
	 */
	public static ConnectionInitializer ofClass(final Class<?> type) {
		if (type == null) {
			throw new InvalidInitializerException("A connection initializer must not be null");
		}
		if (!SingleConnection.class.isAssignableFrom(type)
				|| type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
			throw new InvalidInitializerException(
					"A connection initializer must be a concrete SingleConnection class: " + type.getName());
		}

		final Constructor<?> constructor;
		try {
			constructor = type.getConstructor(ConnectionParameters.class);
		} catch (NoSuchMethodException e) {
			throw new InvalidInitializerException(
					type.getName() + " has no public constructor taking ConnectionParameters", e);
		}

		ConnectionConstructor ctor = new ConnectionConstructor() {
			@Override
			public SingleConnection newConnection(ConnectionParameters parameters) {
				try {
					return (SingleConnection) constructor.newInstance(parameters);
				} catch (InvocationTargetException e) {
					if (e.getCause() instanceof RuntimeException) {
						throw (RuntimeException) e.getCause();
					}
					throw new ClientException("Failed to create " + type.getName(), e.getCause());
				} catch (ReflectiveOperationException e) {
					throw new ClientException("Failed to create " + type.getName(), e);
				}
			}
		};
		return new TypeInitializer(ctor, type.getName());
	}

	public static ConnectionInitializer ofClassName(String className) {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		return ofClassName(className, classLoader != null ? classLoader : ConnectionInitializer.class.getClassLoader());
	}

	public static ConnectionInitializer ofClassName(String className, ClassLoader classLoader) {
		if (className == null || className.trim().isEmpty()) {
			throw new InvalidInitializerException("A connection initializer class name must not be empty");
		}
		try {
			return ofClass(Class.forName(className.trim(), true, classLoader));
		} catch (ClassNotFoundException e) {
			throw new InvalidInitializerException("Connection class not found: " + className, e);
		}
	}

	private static final class TypeInitializer extends ConnectionInitializer {

		private final ConnectionConstructor constructor;
		private final String name;

		TypeInitializer(ConnectionConstructor constructor, String name) {
			this.constructor = constructor;
			this.name = name;
		}

		@Override
		public boolean isLazy() {
			return false;
		}

		@Override
		public SingleConnection initialize(ConnectionParameters parameters, ConnectionFactory factory) {
			return constructor.newConnection(parameters);
		}

		@Override
		public String toString() {
			return "type(" + name + ")";
		}
	}

	private static final class LazyInitializer extends ConnectionInitializer {

		private final LazyConnectionInitializer function;

		LazyInitializer(LazyConnectionInitializer function) {
			this.function = function;
		}

		@Override
		public boolean isLazy() {
			return true;
		}

		@Override
		public SingleConnection initialize(ConnectionParameters parameters, ConnectionFactory factory) {
			return function.create(parameters, factory);
		}

		@Override
		public String toString() {
			return "lazy(" + function + ")";
		}
	}
}
