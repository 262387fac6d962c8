package com.example.skirmish.player;

import com.example.skirmish.combat.AttackController;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatResult;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.SkillType;

/**
 * The player's attack loop. The player does not chase: the session ends as soon
 * as the target is out of melee range. Landed hits award combat XP by style.
 */
public class PlayerAttackController extends AttackController {

    private final PlayerCharacter player;

    public PlayerAttackController(PlayerCharacter player, CombatMath math, CombatConfig config) {
        super(player, math, config);
        this.player = player;
    }

    /**
     * Try to start attacking {@code target}.
     *
     * @return false when the target is dead or out of range, when the previous
     *         session's cooldown is still running, or when already attacking it
     */
    public boolean tryAttackTarget(CombatTarget target) {
        if (target == null || !target.isAlive()) return false;
        if (player.getPosition().distanceTo(target.getPosition()) > config.getMeleeRange()) return false;
        if (!isAttacking() && getCooldownRemainingTicks() > 0) return false;
        if (isAttacking() && getTarget() == target) return false;
        return beginAttacking(target);
    }

    @Override
    protected CombatantStats attackerStats(CombatTarget target) {
        return player.getAttackStats();
    }

    @Override
    protected boolean continueOutOfRange(CombatTarget target) {
        return false;
    }

    @Override
    protected int cooldownAfterKill(int attackSpeedTicks) {
        return 0;
    }

    @Override
    protected void afterAttack(CombatResult result) {
        if (result.isHit()) awardXp(result.getDamage(), player.getStyle());
    }

    void awardXp(int damage, CombatStyle style) {
        if (damage <= 0) return;
        SkillSet skills = player.getSkills();
        skills.addXp(SkillType.HITPOINTS, damage * config.getHitpointsXpPerDamage());
        double total = damage * config.getXpPerDamage();
        switch (style) {
            case ACCURATE:
                skills.addXp(SkillType.ATTACK, total);
                break;
            case AGGRESSIVE:
                skills.addXp(SkillType.STRENGTH, total);
                break;
            case DEFENSIVE:
                skills.addXp(SkillType.DEFENCE, total);
                break;
            case CONTROLLED:
            default:
                int share = (int) Math.floor(total / 3.0);
                double remainder = Math.rint(total - share * 3);
                skills.addXp(SkillType.ATTACK, share);
                skills.addXp(SkillType.STRENGTH, share);
                skills.addXp(SkillType.DEFENCE, share + remainder);
                break;
        }
    }
}
