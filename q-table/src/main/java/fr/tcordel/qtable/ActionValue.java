package fr.tcordel.qtable;

public record ActionValue<A>(A action, double value) {

	@Override
	public String toString() {
		return action + " -> " + value;
	}
}
