package dao.fhe.mystery.model;

import java.util.List;
import java.util.Objects;

/**
 * One opaque value per tracked field: a contribution, or an accusation's guess.
 */
public record SealedTriple(CipherHandle weapon, CipherHandle room, CipherHandle suspect) {

    public SealedTriple {
        Objects.requireNonNull(weapon, "weapon");
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(suspect, "suspect");
    }

    public CipherHandle get(Field field) {
        return switch (field) {
            case WEAPON -> weapon;
            case ROOM -> room;
            case SUSPECT -> suspect;
        };
    }

    public List<CipherHandle> values() {
        return List.of(weapon, room, suspect);
    }
}
