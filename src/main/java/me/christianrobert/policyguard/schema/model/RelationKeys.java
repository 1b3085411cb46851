package me.christianrobert.policyguard.schema.model;

import java.util.List;

/**
 * Foreign key / primary key column pairs joining a model to a related model.
 * When {@code ownedByModel} is true the fk columns live on the model that declares the relation field,
 * otherwise they live on the related model.
 */
public class RelationKeys {

    private final List<KeyPair> keyPairs;
    private final boolean ownedByModel;

    public RelationKeys(List<KeyPair> keyPairs, boolean ownedByModel) {
        this.keyPairs = List.copyOf(keyPairs);
        this.ownedByModel = ownedByModel;
    }

    public List<KeyPair> getKeyPairs() {
        return keyPairs;
    }

    public boolean isOwnedByModel() {
        return ownedByModel;
    }

    public static class KeyPair {
        private final String fk;
        private final String pk;

        public KeyPair(String fk, String pk) {
            this.fk = fk;
            this.pk = pk;
        }

        public String getFk() {
            return fk;
        }

        public String getPk() {
            return pk;
        }

        @Override
        public String toString() {
            return fk + " -> " + pk;
        }
    }
}
