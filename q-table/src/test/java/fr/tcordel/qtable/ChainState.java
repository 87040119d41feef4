package fr.tcordel.qtable;

import java.util.List;

/**
 * Position on a line of {@code length + 1} cells. Moving right from the last but one
 * cell ends the episode with a reward of 10, every other move costs 1.
 */
public record ChainState(int position, int length) implements State<String> {

	public static final String LEFT = "L";
	public static final String RIGHT = "R";

	@Override
	public List<String> getLegalActions() {
		return position == length ? List.of() : List.of(LEFT, RIGHT);
	}

	@Override
	public State<String> makeTransition(String action) {
		return new ChainState(LEFT.equals(action) ? Math.max(0, position - 1) : position + 1, length);
	}

	@Override
	public double getRewardForLastMove() {
		return position == length ? 10 : -1;
	}
}
