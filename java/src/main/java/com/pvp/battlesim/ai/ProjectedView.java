package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.StatStages;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;

import java.util.List;

/**
 * A combatant as it would stand at a future point of a planned sequence.
 */
final class ProjectedView implements CombatantView {
    private final CombatantView base;
    private final int hp;
    private final int energy;
    private final int shields;
    private final int attackStage;

    private ProjectedView(CombatantView base, int hp, int energy, int shields, int attackStage) {
        this.base = base;
        this.hp = Math.max(0, hp);
        this.energy = Math.max(0, Math.min(100, energy));
        this.shields = Math.max(0, shields);
        this.attackStage = StatStages.clamp(attackStage);
    }

    static ProjectedView attacker(CombatantView base, int energy, int attackStageDelta) {
        return new ProjectedView(base, base.getHp(), energy, base.getShields(),
                base.getAttackStage() + attackStageDelta);
    }

    static ProjectedView defender(CombatantView base, int hp, int shields) {
        return new ProjectedView(base, hp, base.getEnergy(), shields, base.getAttackStage());
    }

    @Override
    public String getId() {
        return base.getId();
    }

    @Override
    public CombatType getPrimaryType() {
        return base.getPrimaryType();
    }

    @Override
    public CombatType getSecondaryType() {
        return base.getSecondaryType();
    }

    @Override
    public double getAttack() {
        return base.getAttack();
    }

    @Override
    public double getDefense() {
        return base.getDefense();
    }

    @Override
    public int getMaxHp() {
        return base.getMaxHp();
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
        return base.getDefenseStage();
    }

    @Override
    public int getCooldown() {
        return 0;
    }

    @Override
    public FastMove getFastMove() {
        return base.getFastMove();
    }

    @Override
    public List<ChargedMove> getChargedMoves() {
        return base.getChargedMoves();
    }

    @Override
    public boolean isFarmEnergy() {
        return base.isFarmEnergy();
    }

    @Override
    public boolean isBaitShields() {
        return base.isBaitShields();
    }

    @Override
    public boolean isOptimizeMoveTiming() {
        return base.isOptimizeMoveTiming();
    }
}
