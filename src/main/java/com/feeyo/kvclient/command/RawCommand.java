package com.feeyo.kvclient.command;

import java.util.List;
import java.util.Locale;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A protocol command as an ordered list of tokens, the first one being the command id.
 *
 * e.g. [AUTH, secret], [SELECT, 3], [GET, key]
 */
public class RawCommand {

	private final ImmutableList<String> tokens;

	public RawCommand(String... tokens) {
		this( ImmutableList.copyOf(tokens) );
	}

	public RawCommand(List<String> tokens) {
		if ( tokens == null || tokens.isEmpty() ) {
			throw new IllegalArgumentException("The token list must contain at least the command id");
		}
		this.tokens = ImmutableList.copyOf( tokens );
	}

	public static RawCommand create(String id, Object... arguments) {
		ImmutableList.Builder<String> builder = ImmutableList.builder();
		builder.add( id );
		for (Object argument : arguments) {
			builder.add( String.valueOf(argument) );
		}
		return new RawCommand( builder.build() );
	}

	public String getId() {
		return tokens.get(0).toUpperCase(Locale.ROOT);
	}

	public List<String> getArguments() {
		return tokens.subList(1, tokens.size());
	}

	public String getArgument(int index) {
		List<String> arguments = getArguments();
		return index < arguments.size() ? arguments.get(index) : null;
	}

	public int getNumArgs() {
		return tokens.size() - 1;
	}

	public List<String> getTokens() {
		return tokens;
	}

	@Override
	public int hashCode() {
		return tokens.hashCode();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return tokens.equals( ((RawCommand) o).tokens );
	}

	@Override
	public String toString() {
		return Joiner.on(' ').join(tokens);
	}
}
