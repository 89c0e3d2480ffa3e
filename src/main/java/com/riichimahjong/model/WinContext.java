package com.riichimahjong.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 和牌时的场况：风位、立直、和牌方式、特殊和牌标记、宝牌指示牌、本场数等
 */
public class WinContext {
    private Wind seatWind = Wind.SOUTH;                    // 自风
    private Wind roundWind = Wind.EAST;                    // 场风
    private RiichiType riichi = RiichiType.NONE;           // 立直状态
    private boolean ippatsu;                               // 一发
    private WinMethod winMethod = WinMethod.RON;           // 和牌方式
    private boolean haitei;                                // 海底摸月（最后一张自摸）
    private boolean houtei;                                // 河底捞鱼（最后一张荣和）
    private boolean rinshan;                               // 岭上开花
    private boolean chankan;                               // 抢杠
    private boolean tenhou;                                // 天和
    private boolean chiihou;                               // 地和
    private boolean renhou;                                // 人和
    private List<Tile> doraIndicators = new ArrayList<>();     // 宝牌指示牌
    private List<Tile> uraDoraIndicators = new ArrayList<>();  // 里宝牌指示牌（仅立直时计算）
    private int honba;                                     // 本场数
    private int riichiSticks;                              // 场上供托的立直棒数

    public Wind getSeatWind() {
        return seatWind;
    }

    public void setSeatWind(Wind seatWind) {
        this.seatWind = seatWind;
    }

    public Wind getRoundWind() {
        return roundWind;
    }

    public void setRoundWind(Wind roundWind) {
        this.roundWind = roundWind;
    }

    /**
     * 是否庄家：自风为东即为庄家
     */
    public boolean isDealer() {
        return seatWind == Wind.EAST;
    }

    public RiichiType getRiichi() {
        return riichi;
    }

    public void setRiichi(RiichiType riichi) {
        this.riichi = riichi;
    }

    public boolean isIppatsu() {
        return ippatsu;
    }

    public void setIppatsu(boolean ippatsu) {
        this.ippatsu = ippatsu;
    }

    public WinMethod getWinMethod() {
        return winMethod;
    }

    public void setWinMethod(WinMethod winMethod) {
        this.winMethod = winMethod;
    }

    public boolean isTsumo() {
        return winMethod == WinMethod.TSUMO;
    }

    public boolean isRon() {
        return winMethod == WinMethod.RON;
    }

    public boolean isHaitei() {
        return haitei;
    }

    public void setHaitei(boolean haitei) {
        this.haitei = haitei;
    }

    public boolean isHoutei() {
        return houtei;
    }

    public void setHoutei(boolean houtei) {
        this.houtei = houtei;
    }

    public boolean isRinshan() {
        return rinshan;
    }

    public void setRinshan(boolean rinshan) {
        this.rinshan = rinshan;
    }

    public boolean isChankan() {
        return chankan;
    }

    public void setChankan(boolean chankan) {
        this.chankan = chankan;
    }

    public boolean isTenhou() {
        return tenhou;
    }

    public void setTenhou(boolean tenhou) {
        this.tenhou = tenhou;
    }

    public boolean isChiihou() {
        return chiihou;
    }

    public void setChiihou(boolean chiihou) {
        this.chiihou = chiihou;
    }

    public boolean isRenhou() {
        return renhou;
    }

    public void setRenhou(boolean renhou) {
        this.renhou = renhou;
    }

    public List<Tile> getDoraIndicators() {
        return doraIndicators;
    }

    public void setDoraIndicators(List<Tile> doraIndicators) {
        this.doraIndicators = doraIndicators == null ? new ArrayList<>() : doraIndicators;
    }

    public List<Tile> getUraDoraIndicators() {
        return uraDoraIndicators;
    }

    public void setUraDoraIndicators(List<Tile> uraDoraIndicators) {
        this.uraDoraIndicators = uraDoraIndicators == null ? new ArrayList<>() : uraDoraIndicators;
    }

    /**
     * 宝牌（由指示牌推出的下一张）
     */
    public List<Tile> getDoraTiles() {
        List<Tile> dora = new ArrayList<>();
        for (Tile indicator : doraIndicators) {
            dora.add(indicator.doraSuccessor());
        }
        return dora;
    }

    public int getHonba() {
        return honba;
    }

    public void setHonba(int honba) {
        this.honba = honba;
    }

    public int getRiichiSticks() {
        return riichiSticks;
    }

    public void setRiichiSticks(int riichiSticks) {
        this.riichiSticks = riichiSticks;
    }

    @Override
    public String toString() {
        return "WinContext{seat=" + seatWind + ", round=" + roundWind + ", riichi=" + riichi
                + ", method=" + winMethod + ", honba=" + honba + "}";
    }
}
