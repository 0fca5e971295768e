package com.pvp.battlesim;

import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-set CombatantView for decision and damage tests.
 * Attack and defense default to 100 so damage is easy to work out by hand.
 */
public class StubCombatant implements CombatantView {
    private final String id;
    private CombatType primaryType = CombatType.NORMAL;
    private CombatType secondaryType;
    private double attack = 100;
    private double defense = 100;
    private int maxHp = 100;
    private int hp = 100;
    private int energy;
    private int shields;
    private int attackStage;
    private int defenseStage;
    private int cooldown;
    private FastMove fastMove = new FastMove("TACKLE", "Tackle", CombatType.NORMAL, 4, 4, 1);
    private final List<ChargedMove> chargedMoves = new ArrayList<>();
    private boolean farmEnergy;
    private boolean baitShields;
    private boolean optimizeMoveTiming;

    public StubCombatant(String id) {
        this.id = id;
    }

    public StubCombatant types(CombatType primary, CombatType secondary) {
        this.primaryType = primary;
        this.secondaryType = secondary;
        return this;
    }

    public StubCombatant attack(double attack) {
        this.attack = attack;
        return this;
    }

    public StubCombatant defense(double defense) {
        this.defense = defense;
        return this;
    }

    public StubCombatant hp(int hp, int maxHp) {
        this.hp = hp;
        this.maxHp = maxHp;
        return this;
    }

    public StubCombatant hp(int hp) {
        this.hp = hp;
        return this;
    }

    public StubCombatant energy(int energy) {
        this.energy = energy;
        return this;
    }

    public StubCombatant shields(int shields) {
        this.shields = shields;
        return this;
    }

    public StubCombatant attackStage(int attackStage) {
        this.attackStage = attackStage;
        return this;
    }

    public StubCombatant defenseStage(int defenseStage) {
        this.defenseStage = defenseStage;
        return this;
    }

    public StubCombatant cooldown(int cooldown) {
        this.cooldown = cooldown;
        return this;
    }

    public StubCombatant fastMove(FastMove fastMove) {
        this.fastMove = fastMove;
        return this;
    }

    public StubCombatant chargedMoves(ChargedMove... moves) {
        this.chargedMoves.clear();
        this.chargedMoves.addAll(List.of(moves));
        return this;
    }

    public StubCombatant farmEnergy(boolean farmEnergy) {
        this.farmEnergy = farmEnergy;
        return this;
    }

    public StubCombatant baitShields(boolean baitShields) {
        this.baitShields = baitShields;
        return this;
    }

    public StubCombatant optimizeMoveTiming(boolean optimizeMoveTiming) {
        this.optimizeMoveTiming = optimizeMoveTiming;
        return this;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public CombatType getPrimaryType() {
        return primaryType;
    }

    @Override
    public CombatType getSecondaryType() {
        return secondaryType;
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
}
