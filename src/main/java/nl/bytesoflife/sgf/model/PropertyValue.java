package nl.bytesoflife.sgf.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Value of one SGF property: either a single bracketed string or an ordered
 * list of them ({@code AB[aa][bb]}).
 */
public sealed interface PropertyValue permits PropertyValue.Single, PropertyValue.Multiple {

    /**
     * All values in order. A single value yields a one-element list.
     */
    List<String> values();

    /**
     * Returns the value that results from adding another bracket group.
     * A single value is promoted to a two-element list.
     */
    PropertyValue append(String value);

    record Single(String value) implements PropertyValue {

        @Override
        public List<String> values() {
            return List.of(value);
        }

        @Override
        public PropertyValue append(String next) {
            return new Multiple(List.of(value, next));
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Multiple(List<String> values) implements PropertyValue {

        public Multiple {
            values = List.copyOf(values);
        }

        @Override
        public PropertyValue append(String next) {
            List<String> appended = new ArrayList<>(values);
            appended.add(next);
            return new Multiple(appended);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
