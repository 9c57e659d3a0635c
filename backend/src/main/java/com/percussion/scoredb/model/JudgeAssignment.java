package com.percussion.scoredb.model;

import jakarta.persistence.*;

/**
 * Caption a judge adjudicated at a show. Not populated by recap sheet ingestion.
 */
@Entity
@Table(name = "judge_assignments")
public class JudgeAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "show_id", foreignKey = @ForeignKey(name = "fk_judge_assignment_show"))
    private Show show;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "judge_id", foreignKey = @ForeignKey(name = "fk_judge_assignment_judge"))
    private Judge judge;

    @Column(length = 64)
    private String caption; // e.g. "Effect - Music", "Visual"

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Show getShow() { return show; }
    public void setShow(Show show) { this.show = show; }

    public Judge getJudge() { return judge; }
    public void setJudge(Judge judge) { this.judge = judge; }

    public String getCaption() { return caption; }
    public void setCaption(String caption) { this.caption = caption; }
}
