package com.wataruto.engine.game.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个玩家剩余的长条。
 * 3 格不限量、不计数；4 格、5 格开局各一条。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerBlocks {

    public static final int INITIAL_LEN4 = 1;
    public static final int INITIAL_LEN5 = 1;

    private int len4 = INITIAL_LEN4;

    private int len5 = INITIAL_LEN5;

    public static PlayerBlocks initial() {
        return new PlayerBlocks(INITIAL_LEN4, INITIAL_LEN5);
    }

    /** 这个长度的长条是否还能用 */
    public boolean has(int length) {
        return switch (length) {
            case 3 -> true;
            case 4 -> len4 > 0;
            case 5 -> len5 > 0;
            default -> false;
        };
    }

    /** 扣掉一条该长度的长条；没有剩余返回 false */
    public boolean use(int length) {
        switch (length) {
            case 3:
                return true;
            case 4:
                if (len4 <= 0) return false;
                len4--;
                return true;
            case 5:
                if (len5 <= 0) return false;
                len5--;
                return true;
            default:
                return false;
        }
    }

    /** 归还 {@link #use(int)} 扣掉的长条 */
    public void restore(int length) {
        if (length == 4) len4++;
        else if (length == 5) len5++;
    }

    public PlayerBlocks copy() {
        return new PlayerBlocks(len4, len5);
    }
}
