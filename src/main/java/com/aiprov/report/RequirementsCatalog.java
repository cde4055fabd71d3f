package com.aiprov.report;

import java.util.List;
import java.util.Optional;

public interface RequirementsCatalog {

    Optional<Requirement> find(String id);

    List<Requirement> all();

    default boolean available() {
        return true;
    }

    static RequirementsCatalog none() {
        return NoRequirements.INSTANCE;
    }

    final class NoRequirements implements RequirementsCatalog {
        private static final NoRequirements INSTANCE = new NoRequirements();

        private NoRequirements() {
        }

        @Override
        public Optional<Requirement> find(String id) {
            return Optional.empty();
        }

        @Override
        public List<Requirement> all() {
            return List.of();
        }

        @Override
        public boolean available() {
            return false;
        }
    }
}
