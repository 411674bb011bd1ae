package io.vena.pathspace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Summarizes an insert. A concrete-path insert touches at most one node;
 * a glob insert reports one entry per matched node in {@link #paths()} or {@link #errors()}.
 * A partially successful glob insert is not rolled back.
 */
@Value
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class InsertReturn<T> {
	int nbrInserted;
	int nbrTasksInserted;
	List<T> values;
	List<Path> paths;
	List<SpaceError> errors;

	public int nbrErrors() {
		return errors.size();
	}

	public boolean isSuccess() {
		return errors.isEmpty();
	}

	/**
	 * @return the value inserted at a concrete path, or the first of several from a glob insert
	 */
	public Optional<T> value() {
		return values.stream().findFirst();
	}

	public Optional<SpaceError> error() {
		return errors.stream().findFirst();
	}

	static <TT> InsertReturn<TT> failure(SpaceError error) {
		return new InsertReturn<>(0, 0, List.of(), List.of(), List.of(error));
	}

	static <TT> Accumulator<TT> accumulator() {
		return new Accumulator<>();
	}

	static final class Accumulator<TT> {
		private int nbrInserted = 0;
		private int nbrTasksInserted = 0;
		private final List<TT> values = new ArrayList<>();
		private final List<Path> paths = new ArrayList<>();
		private final List<SpaceError> errors = new ArrayList<>();

		void inserted(Path path, TT value, boolean isTask) {
			nbrInserted++;
			if (isTask) {
				nbrTasksInserted++;
			}
			values.add(value);
			paths.add(path);
		}

		void failed(SpaceError error) {
			errors.add(error);
		}

		int nbrInserted() {
			return nbrInserted;
		}

		InsertReturn<TT> build() {
			return new InsertReturn<>(nbrInserted, nbrTasksInserted, List.copyOf(values), List.copyOf(paths), List.copyOf(errors));
		}
	}
}
