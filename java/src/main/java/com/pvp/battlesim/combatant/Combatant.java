package com.pvp.battlesim.combatant;

import com.pvp.battlesim.battle.StatStages;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A configured combatant and its mutable battle state.
 * Each battle owns its own copies; see {@link #copy()}.
 */
public class Combatant implements CombatantView {

    public static final int MAX_ENERGY = 100;
    public static final int MAX_CHARGED_MOVES = 2;

    // Template
    private final String id;
    private final String name;
    private final CombatType primaryType;
    private final CombatType secondaryType;
    private final BaseStats baseStats;
    private final IndividualValues ivs;
    private final double level;
    private final ShadowType shadowType;
    private final FastMove fastMove;
    private final List<ChargedMove> chargedMoves;
    private final boolean farmEnergy;
    private final boolean baitShields;
    private final boolean optimizeMoveTiming;

    // Derived
    private final double attack;
    private final double defense;
    private final int maxHp;

    // Battle state
    private int hp;
    private int energy;
    private int shields;
    private int attackStage;
    private int defenseStage;
    private int cooldown;

    private Combatant(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.primaryType = b.primaryType;
        this.secondaryType = b.secondaryType;
        this.baseStats = b.baseStats;
        this.ivs = b.ivs;
        this.level = b.level;
        this.shadowType = b.shadowType;
        this.fastMove = b.fastMove;
        this.chargedMoves = List.copyOf(b.chargedMoves);
        this.farmEnergy = b.farmEnergy;
        this.baitShields = b.baitShields;
        this.optimizeMoveTiming = b.optimizeMoveTiming;

        double cpm = CpMultiplier.forLevel(level);
        this.attack = (baseStats.attack() + ivs.attack()) * cpm * shadowType.getAttackFactor();
        this.defense = (baseStats.defense() + ivs.defense()) * cpm * shadowType.getDefenseFactor();
        this.maxHp = (int) Math.floor((baseStats.stamina() + ivs.stamina()) * cpm);

        this.hp = b.hp != null ? b.hp : maxHp;
        this.energy = b.energy;
        this.shields = b.shields;
        this.attackStage = b.attackStage;
        this.defenseStage = b.defenseStage;
        this.cooldown = 0;
    }

    private Combatant(Combatant other) {
        this.id = other.id;
        this.name = other.name;
        this.primaryType = other.primaryType;
        this.secondaryType = other.secondaryType;
        this.baseStats = other.baseStats;
        this.ivs = other.ivs;
        this.level = other.level;
        this.shadowType = other.shadowType;
        this.fastMove = other.fastMove;
        this.chargedMoves = other.chargedMoves;
        this.farmEnergy = other.farmEnergy;
        this.baitShields = other.baitShields;
        this.optimizeMoveTiming = other.optimizeMoveTiming;
        this.attack = other.attack;
        this.defense = other.defense;
        this.maxHp = other.maxHp;
        this.hp = other.hp;
        this.energy = other.energy;
        this.shields = other.shields;
        this.attackStage = other.attackStage;
        this.defenseStage = other.defenseStage;
        this.cooldown = other.cooldown;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Independent copy with the same template and current state.
     */
    public Combatant copy() {
        return new Combatant(this);
    }

    /**
     * Restore full health and clear stages and cooldown for a new battle.
     */
    public void reset(int shields, int energy) {
        if (shields < 0) {
            throw new InvalidCombatantException("Shields must be non-negative, got " + shields);
        }
        if (energy < 0 || energy > MAX_ENERGY) {
            throw new InvalidCombatantException("Energy must be in [0, 100], got " + energy);
        }
        this.hp = maxHp;
        this.energy = energy;
        this.shields = shields;
        this.attackStage = 0;
        this.defenseStage = 0;
        this.cooldown = 0;
    }

    // ==================== STATE CHANGES ====================

    /**
     * Subtract damage, flooring health at zero.
     */
    public void takeDamage(int damage) {
        hp = Math.max(0, hp - Math.max(0, damage));
    }

    /**
     * Add energy, capped at 100.
     */
    public void gainEnergy(int amount) {
        energy = Math.min(MAX_ENERGY, energy + Math.max(0, amount));
    }

    /**
     * Spend energy for a charged move.
     * @throws IllegalStateException if there is not enough energy
     */
    public void spendEnergy(int amount) {
        if (amount > energy) {
            throw new IllegalStateException(id + " cannot spend " + amount + " energy with " + energy);
        }
        energy -= amount;
    }

    /**
     * Consume one shield.
     * @throws IllegalStateException if none are left
     */
    public void useShield() {
        if (shields <= 0) {
            throw new IllegalStateException(id + " has no shields left");
        }
        shields--;
    }

    /**
     * Shift attack and defense stages, clamped to the legal range.
     */
    public void applyStages(int attackDelta, int defenseDelta) {
        attackStage = StatStages.clamp(attackStage + attackDelta);
        defenseStage = StatStages.clamp(defenseStage + defenseDelta);
    }

    public void setCooldown(int cooldown) {
        this.cooldown = Math.max(0, cooldown);
    }

    public void tickCooldown() {
        if (cooldown > 0) {
            cooldown--;
        }
    }

    /**
     * Set current health directly, e.g. to stage a mid-battle scenario.
     */
    public void setHp(int hp) {
        if (hp < 0 || hp > maxHp) {
            throw new InvalidCombatantException("HP must be in [0, " + maxHp + "], got " + hp);
        }
        this.hp = hp;
    }

    // ==================== DERIVED ====================

    /**
     * Combat power for the configured level, IVs and shadow form.
     */
    public int getCombatPower() {
        double cpm = CpMultiplier.forLevel(level);
        double atk = (baseStats.attack() + ivs.attack()) * shadowType.getAttackFactor();
        double def = (baseStats.defense() + ivs.defense()) * shadowType.getDefenseFactor();
        double sta = baseStats.stamina() + ivs.stamina();
        int cp = (int) Math.floor(atk * Math.sqrt(def) * Math.sqrt(sta) * cpm * cpm / 10);
        return Math.max(10, cp);
    }

    // ==================== GETTERS ====================

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public CombatType getPrimaryType() {
        return primaryType;
    }

    @Override
    public CombatType getSecondaryType() {
        return secondaryType;
    }

    public BaseStats getBaseStats() {
        return baseStats;
    }

    public IndividualValues getIvs() {
        return ivs;
    }

    public double getLevel() {
        return level;
    }

    public ShadowType getShadowType() {
        return shadowType;
    }

    @Override
    public double getAttack() {
        return attack;
    }

    @Override
    public double getDefense() {
        return defense;
    }

    @Override
    public int getMaxHp() {
        return maxHp;
    }

    @Override
    public int getHp() {
        return hp;
    }

    @Override
    public int getEnergy() {
        return energy;
    }

    @Override
    public int getShields() {
        return shields;
    }

    @Override
    public int getAttackStage() {
        return attackStage;
    }

    @Override
    public int getDefenseStage() {
        return defenseStage;
    }

    @Override
    public int getCooldown() {
        return cooldown;
    }

    @Override
    public FastMove getFastMove() {
        return fastMove;
    }

    @Override
    public List<ChargedMove> getChargedMoves() {
        return chargedMoves;
    }

    @Override
    public boolean isFarmEnergy() {
        return farmEnergy;
    }

    @Override
    public boolean isBaitShields() {
        return baitShields;
    }

    @Override
    public boolean isOptimizeMoveTiming() {
        return optimizeMoveTiming;
    }

    @Override
    public String toString() {
        return String.format("%s (HP %d/%d, Energy %d, Shields %d)", name, hp, maxHp, energy, shields);
    }

    // ==================== BUILDER ====================

    /**
     * Validating builder. Every rule violation throws {@link InvalidCombatantException}.
     */
    public static class Builder {
        private final String id;
        private String name;
        private CombatType primaryType;
        private CombatType secondaryType;
        private BaseStats baseStats;
        private IndividualValues ivs = IndividualValues.ZERO;
        private double level = 40;
        private ShadowType shadowType = ShadowType.NORMAL;
        private FastMove fastMove;
        private final List<ChargedMove> chargedMoves = new ArrayList<>();
        private boolean farmEnergy;
        private boolean baitShields = true;
        private boolean optimizeMoveTiming;
        private Integer hp;
        private int energy;
        private int shields = 2;
        private int attackStage;
        private int defenseStage;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder types(CombatType primary, CombatType secondary) {
            this.primaryType = primary;
            this.secondaryType = secondary;
            return this;
        }

        public Builder type(CombatType primary) {
            return types(primary, null);
        }

        public Builder baseStats(int attack, int defense, int stamina) {
            this.baseStats = new BaseStats(attack, defense, stamina);
            return this;
        }

        public Builder baseStats(BaseStats baseStats) {
            this.baseStats = baseStats;
            return this;
        }

        public Builder ivs(int attack, int defense, int stamina) {
            this.ivs = new IndividualValues(attack, defense, stamina);
            return this;
        }

        public Builder ivs(IndividualValues ivs) {
            this.ivs = ivs;
            return this;
        }

        public Builder level(double level) {
            this.level = level;
            return this;
        }

        public Builder shadowType(ShadowType shadowType) {
            this.shadowType = shadowType;
            return this;
        }

        public Builder fastMove(FastMove fastMove) {
            this.fastMove = fastMove;
            return this;
        }

        public Builder chargedMove(ChargedMove move) {
            this.chargedMoves.add(move);
            return this;
        }

        public Builder chargedMoves(List<ChargedMove> moves) {
            this.chargedMoves.addAll(moves);
            return this;
        }

        public Builder farmEnergy(boolean farmEnergy) {
            this.farmEnergy = farmEnergy;
            return this;
        }

        public Builder baitShields(boolean baitShields) {
            this.baitShields = baitShields;
            return this;
        }

        public Builder optimizeMoveTiming(boolean optimizeMoveTiming) {
            this.optimizeMoveTiming = optimizeMoveTiming;
            return this;
        }

        public Builder hp(int hp) {
            this.hp = hp;
            return this;
        }

        public Builder energy(int energy) {
            this.energy = energy;
            return this;
        }

        public Builder shields(int shields) {
            this.shields = shields;
            return this;
        }

        public Builder attackStage(int attackStage) {
            this.attackStage = attackStage;
            return this;
        }

        public Builder defenseStage(int defenseStage) {
            this.defenseStage = defenseStage;
            return this;
        }

        /**
         * Validate and build.
         * @throws InvalidCombatantException if any setting is illegal
         */
        public Combatant build() {
            if (id == null || id.isBlank()) {
                throw new InvalidCombatantException("Combatant id is required");
            }
            if (primaryType == null) {
                throw new InvalidCombatantException(id + ": primary type is required");
            }
            if (primaryType == secondaryType) {
                throw new InvalidCombatantException(id + ": types must differ, got " + primaryType + " twice");
            }
            if (baseStats == null) {
                throw new InvalidCombatantException(id + ": base stats are required");
            }
            if (ivs == null) {
                throw new InvalidCombatantException(id + ": IVs are required");
            }
            if (!CpMultiplier.isValidLevel(level)) {
                throw new InvalidCombatantException(id + ": level must be in [1, 55] in steps of 0.5, got " + level);
            }
            if (shadowType == null) {
                throw new InvalidCombatantException(id + ": shadow type is required");
            }
            if (fastMove == null) {
                throw new InvalidCombatantException(id + ": a fast move is required");
            }
            if (chargedMoves.size() > MAX_CHARGED_MOVES) {
                throw new InvalidCombatantException(
                        id + ": at most 2 charged moves allowed, got " + chargedMoves.size());
            }
            Set<String> seen = new HashSet<>();
            for (ChargedMove move : chargedMoves) {
                if (move == null) {
                    throw new InvalidCombatantException(id + ": charged move must not be null");
                }
                if (!seen.add(move.id())) {
                    throw new InvalidCombatantException(id + ": duplicate charged move " + move.id());
                }
            }
            if (energy < 0 || energy > MAX_ENERGY) {
                throw new InvalidCombatantException(id + ": energy must be in [0, 100], got " + energy);
            }
            if (shields < 0) {
                throw new InvalidCombatantException(id + ": shields must be non-negative, got " + shields);
            }
            if (!StatStages.isValid(attackStage) || !StatStages.isValid(defenseStage)) {
                throw new InvalidCombatantException(
                        id + ": stat stages must be in [-4, 4], got " + attackStage + "/" + defenseStage);
            }
            Combatant combatant = new Combatant(this);
            if (hp != null && (hp <= 0 || hp > combatant.maxHp)) {
                throw new InvalidCombatantException(
                        id + ": HP must be in [1, " + combatant.maxHp + "], got " + hp);
            }
            return combatant;
        }
    }
}
