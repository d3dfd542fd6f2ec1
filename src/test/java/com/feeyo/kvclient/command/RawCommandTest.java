package com.feeyo.kvclient.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

class RawCommandTest {

	@Test
	void testIdAndArguments() {
		RawCommand command = new RawCommand("set", "foo", "bar");

		assertEquals("SET", command.getId());
		assertEquals(Arrays.asList("foo", "bar"), command.getArguments());
		assertEquals(2, command.getNumArgs());
		assertEquals("bar", command.getArgument(1));
		assertNull(command.getArgument(2));
		assertEquals("set foo bar", command.toString());
	}

	@Test
	void testCreateStringifiesArguments() {
		assertEquals(new RawCommand("SELECT", "3"), RawCommand.create("SELECT", 3));
		assertEquals(new RawCommand("EXPIRE", "key", "60"), RawCommand.create("EXPIRE", "key", 60L));
	}

	@Test
	void testEqualityIsTokenBased() {
		assertEquals(new RawCommand("AUTH", "secret"), new RawCommand(Arrays.asList("AUTH", "secret")));
		assertNotEquals(new RawCommand("AUTH", "secret"), new RawCommand("AUTH", "other"));
		assertNotEquals(new RawCommand("auth", "secret"), new RawCommand("AUTH", "secret"));
	}

	@Test
	void testCommandIdIsMandatory() {
		assertThrows(IllegalArgumentException.class, () -> new RawCommand());
		assertThrows(IllegalArgumentException.class, () -> new RawCommand(Collections.<String>emptyList()));
	}
}
